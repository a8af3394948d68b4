/*
 * Copyright (C) 2015-2026 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.cansmi.shared;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.CDKConstants;
import org.openscience.cdk.aromaticity.Aromaticity;
import org.openscience.cdk.aromaticity.ElectronDonation;
import org.openscience.cdk.atomtype.CDKAtomTypeMatcher;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IAtomType;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IBond.Order;
import org.openscience.cdk.interfaces.IChemObjectBuilder;
import org.openscience.cdk.interfaces.IDoubleBondStereochemistry;
import org.openscience.cdk.interfaces.IDoubleBondStereochemistry.Conformation;
import org.openscience.cdk.interfaces.IPseudoAtom;
import org.openscience.cdk.interfaces.IStereoElement;
import org.openscience.cdk.interfaces.ITetrahedralChirality;
import org.openscience.cdk.interfaces.ITetrahedralChirality.Stereo;
import org.openscience.cdk.io.DefaultChemObjectReader;
import org.openscience.cdk.io.MDLV2000Reader;
import org.openscience.cdk.io.MDLV3000Reader;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import org.openscience.cdk.tools.CDKHydrogenAdder;
import org.openscience.cdk.tools.manipulator.AtomContainerManipulator;
import org.openscience.cdk.tools.manipulator.AtomTypeManipulator;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Chirality;
import cz.iocb.cansmi.molecule.Molecule;



/**
 * Class for creating molecules
 */
public class MoleculeCreator
{
    private static final Logger LOGGER = LogManager.getLogger(MoleculeCreator.class);

    private static final ThreadLocal<Aromaticity> aromaticity = new ThreadLocal<Aromaticity>()
    {
        @Override
        protected Aromaticity initialValue()
        {
            return new Aromaticity(ElectronDonation.daylight(), Cycles.or(Cycles.all(), Cycles.all(6)));
        }
    };


    /**
     * Creates a molecule using an MDL string and an MDL reader.
     *
     * @param mol molfile in the V2000 or V3000 format
     * @return configured atom container
     * @throws CDKException
     * @throws IOException
     */
    public static IAtomContainer getMoleculeFromMolfile(String mol) throws CDKException, IOException
    {
        DefaultChemObjectReader mdlReader = null;

        if(mol.contains("M  V30 BEGIN CTAB"))
            mdlReader = new MDLV3000Reader();
        else
            mdlReader = new MDLV2000Reader();

        IAtomContainer readMolecule = SilentChemObjectBuilder.getInstance().newInstance(IAtomContainer.class);

        try
        {
            mdlReader.setReader(new StringReader(mol));
            readMolecule = mdlReader.read(readMolecule);
        }
        finally
        {
            mdlReader.close();
        }

        CDKAtomTypeMatcher matcher = CDKAtomTypeMatcher.getInstance(readMolecule.getBuilder());
        CDKHydrogenAdder adder = CDKHydrogenAdder.getInstance(readMolecule.getBuilder());

        for(IAtom atom : readMolecule.atoms())
        {
            if(atom.getImplicitHydrogenCount() == null && !(atom instanceof IPseudoAtom))
            {
                IAtomType type = matcher.findMatchingAtomType(readMolecule, atom);

                if(type == null)
                {
                    LOGGER.warn("no atom type for atom " + readMolecule.indexOf(atom) + ", assuming no hydrogens");
                    atom.setImplicitHydrogenCount(0);
                    continue;
                }

                AtomTypeManipulator.configure(atom, type);
                adder.addImplicitHydrogens(readMolecule, atom);
            }
        }

        return configureMolecule(readMolecule);
    }


    public static IAtomContainer getMoleculeFromSmiles(String smiles) throws CDKException
    {
        SmilesParser sp = new SmilesParser(SilentChemObjectBuilder.getInstance());
        IAtomContainer molecule = sp.parseSmiles(smiles);

        return configureMolecule(molecule);
    }


    /**
     * Suppresses explicit hydrogens and perceives aromaticity.
     */
    public static IAtomContainer configureMolecule(IAtomContainer molecule) throws CDKException
    {
        IAtomContainer suppressed = AtomContainerManipulator.suppressHydrogens(molecule);
        configureAromaticity(suppressed);

        return suppressed;
    }


    public static void configureAromaticity(IAtomContainer molecule) throws CDKException
    {
        for(IBond bond : molecule.bonds())
            if(bond.isAromatic())
                return;

        aromaticity.get().apply(molecule);
    }


    public static Molecule readSmiles(String smiles) throws CDKException
    {
        return fromAtomContainer(getMoleculeFromSmiles(smiles));
    }


    public static Molecule readMolfile(String mol) throws CDKException, IOException
    {
        return fromAtomContainer(getMoleculeFromMolfile(mol));
    }


    /**
     * Converts a molecule to a CDK atom container. The i-th atom and the j-th bond of the container correspond to the
     * i-th atom and the j-th bond of the molecule. Aromatic bonds get the unset order and the aromatic flag.
     */
    public static IAtomContainer toAtomContainer(Molecule molecule)
    {
        IChemObjectBuilder builder = SilentChemObjectBuilder.getInstance();
        IAtomContainer container = builder.newInstance(IAtomContainer.class);
        Map<Integer, Integer> indexes = new HashMap<Integer, Integer>();

        for(Atom atom : molecule.getAtoms())
        {
            IAtom cdkAtom;

            if(atom.getAtomicNumber() == 0)
                cdkAtom = builder.newInstance(IPseudoAtom.class, atom.getSymbol());
            else
                cdkAtom = builder.newInstance(IAtom.class, atom.getSymbol());

            cdkAtom.setAtomicNumber(atom.getAtomicNumber());
            cdkAtom.setFormalCharge(atom.getCharge());
            cdkAtom.setImplicitHydrogenCount(atom.getHydrogens());
            cdkAtom.setIsAromatic(atom.isAromatic());

            if(atom.getIsotope() > 0)
                cdkAtom.setMassNumber(atom.getIsotope());

            indexes.put(atom.getId(), container.getAtomCount());
            container.addAtom(cdkAtom);
        }

        for(Bond bond : molecule.getBonds())
        {
            container.addBond(indexes.get(bond.getAtom1()), indexes.get(bond.getAtom2()), cdkOrder(bond.getOrder()));

            if(bond.getOrder() == BondOrder.AROMATIC)
                container.getBond(container.getBondCount() - 1).setIsAromatic(true);
        }

        return container;
    }


    private static Order cdkOrder(BondOrder order)
    {
        switch(order)
        {
            case SINGLE:
                return Order.SINGLE;
            case DOUBLE:
                return Order.DOUBLE;
            case TRIPLE:
                return Order.TRIPLE;
            default:
                return Order.UNSET;
        }
    }


    private static BondOrder bondOrder(IBond bond) throws CDKException
    {
        if(bond.isAromatic())
            return BondOrder.AROMATIC;

        if(bond.getOrder() == null)
            throw new CDKException("bond without order");

        switch(bond.getOrder())
        {
            case SINGLE:
                return BondOrder.SINGLE;
            case DOUBLE:
                return BondOrder.DOUBLE;
            case TRIPLE:
                return BondOrder.TRIPLE;
            default:
                throw new CDKException("unsupported bond order: " + bond.getOrder());
        }
    }


    /**
     * Converts a configured CDK atom container to a molecule. Atom identifiers are the atom indexes of the container.
     * Tetrahedral stereo elements become chirality descriptors which remember their ligand order, double bond stereo
     * elements become directional markers on the neighbouring single bonds.
     */
    public static Molecule fromAtomContainer(IAtomContainer container) throws CDKException
    {
        Chirality[] chiralities = new Chirality[container.getAtomCount()];
        Map<IBond, Direction> directions = new HashMap<IBond, Direction>();
        List<IDoubleBondStereochemistry> doubleBonds = new ArrayList<IDoubleBondStereochemistry>();

        for(@SuppressWarnings("rawtypes")
        IStereoElement element : container.stereoElements())
        {
            if(element instanceof ITetrahedralChirality)
            {
                ITetrahedralChirality chirality = (ITetrahedralChirality) element;
                List<Integer> order = new ArrayList<Integer>(4);

                for(IAtom ligand : chirality.getLigands())
                    order.add(container.indexOf(ligand));

                Chirality value = chirality.getStereo() == Stereo.CLOCKWISE ? Chirality.clockwise() :
                        Chirality.anticlockwise();

                chiralities[container.indexOf(chirality.getChiralAtom())] = value.withNeighbourOrder(order);
            }
            else if(element instanceof IDoubleBondStereochemistry)
            {
                doubleBonds.add((IDoubleBondStereochemistry) element);
            }
            else
            {
                LOGGER.warn("ignoring unsupported stereo element " + element.getClass().getSimpleName());
            }
        }

        // conjugated double bonds are encoded outwards from the ones which already have markers
        while(!doubleBonds.isEmpty())
        {
            IDoubleBondStereochemistry next = doubleBonds.get(0);

            for(IDoubleBondStereochemistry candidate : doubleBonds)
            {
                if(isConstrained(container, candidate, directions))
                {
                    next = candidate;
                    break;
                }
            }

            doubleBonds.remove(next);
            addDirections(container, next, directions);
        }


        List<Atom> atoms = new ArrayList<Atom>(container.getAtomCount());

        for(int i = 0; i < container.getAtomCount(); i++)
        {
            IAtom atom = container.getAtom(i);

            String symbol = atom instanceof IPseudoAtom ? "*" : atom.getSymbol();
            int atomicNumber = atom instanceof IPseudoAtom ? 0 :
                    atom.getAtomicNumber() != null ? atom.getAtomicNumber() : AtomicNumbers.of(symbol);
            Integer mapping = atom.getProperty(CDKConstants.ATOM_ATOM_MAPPING);

            atoms.add(new Atom(i, symbol, atomicNumber, valueOf(atom.getFormalCharge()),
                    valueOf(atom.getImplicitHydrogenCount()), valueOf(atom.getMassNumber()), atom.isAromatic(),
                    chiralities[i], false, valueOf(mapping)));
        }


        List<Bond> bonds = new ArrayList<Bond>(container.getBondCount());

        for(IBond bond : container.bonds())
        {
            Direction direction = directions.get(bond);

            if(direction != null)
                bonds.add(new Bond(direction.from, direction.to, bondOrder(bond), direction.stereo));
            else
                bonds.add(new Bond(container.indexOf(bond.getBegin()), container.indexOf(bond.getEnd()),
                        bondOrder(bond)));
        }


        Molecule molecule = new Molecule(atoms, bonds);
        List<Atom> bracketed = new ArrayList<Atom>(atoms.size());

        for(Atom atom : atoms)
            bracketed.add(atom.withBracket(!ImplicitHydrogens.hasDefaultCount(molecule, atom)));

        return molecule.withAtoms(bracketed);
    }


    /**
     * Encodes a CDK double bond configuration as markers on its ligand bonds. A side which is already fixed by the
     * markers of a neighbouring double bond is used as it is, so that conjugated double bonds share consistent markers.
     */
    private static void addDirections(IAtomContainer container, IDoubleBondStereochemistry element,
            Map<IBond, Direction> directions)
    {
        IBond stereoBond = element.getStereoBond();
        IBond[] ligandBonds = element.getBonds();

        IAtom begin = stereoBond.getBegin();
        IAtom end = stereoBond.getEnd();

        IBond first = ligandBonds[0].contains(begin) ? ligandBonds[0] : ligandBonds[1];
        IBond second = first == ligandBonds[0] ? ligandBonds[1] : ligandBonds[0];

        int firstLigand = container.indexOf(first.getOther(begin));
        int beginIndex = container.indexOf(begin);
        int endIndex = container.indexOf(end);
        int secondLigand = container.indexOf(second.getOther(end));

        boolean opposite = element.getStereo() == Conformation.OPPOSITE;

        // both sides are read from the ligand towards the double bond
        BondStereo firstStereo = side(container, begin, first, stereoBond, directions);
        BondStereo secondStereo = side(container, end, second, stereoBond, directions);

        if(firstStereo == null)
            firstStereo = secondStereo == null ? BondStereo.UP : opposite ? secondStereo.inverse() : secondStereo;

        BondStereo expected = opposite ? firstStereo.inverse() : firstStereo;

        if(secondStereo != null && secondStereo != expected)
            LOGGER.warn("conflicting double bond configuration around atoms " + beginIndex + " and " + endIndex);

        if(!hasMarker(container, begin, stereoBond, directions))
            directions.put(first, new Direction(firstLigand, beginIndex, firstStereo));

        if(!hasMarker(container, end, stereoBond, directions))
            directions.put(second, new Direction(endIndex, secondLigand, expected.inverse()));
    }


    private static boolean isConstrained(IAtomContainer container, IDoubleBondStereochemistry element,
            Map<IBond, Direction> directions)
    {
        IBond stereoBond = element.getStereoBond();

        for(IBond ligandBond : element.getBonds())
        {
            IAtom atom = ligandBond.contains(stereoBond.getBegin()) ? stereoBond.getBegin() : stereoBond.getEnd();

            if(side(container, atom, ligandBond, stereoBond, directions) != null)
                return true;
        }

        return false;
    }


    /**
     * Returns the marker of the ligand bond read from the ligand towards the double bond atom, as fixed by the markers
     * already assigned, or null when nothing fixes it yet.
     */
    private static BondStereo side(IAtomContainer container, IAtom atom, IBond ligandBond, IBond stereoBond,
            Map<IBond, Direction> directions)
    {
        IAtom ligand = ligandBond.getOther(atom);
        Direction direction = directions.get(ligandBond);

        if(direction != null)
            return direction.readFrom(container.indexOf(ligand));

        for(IBond bond : container.getConnectedBondsList(atom))
        {
            if(bond == ligandBond || bond == stereoBond)
                continue;

            Direction sibling = directions.get(bond);

            if(sibling != null)
                return sibling.readFrom(container.indexOf(bond.getOther(atom))).inverse();
        }

        if(!isStereoBondAtom(container, ligand))
            return null;

        // the ligand bond is also a substituent of the configured double bond of the ligand
        for(IBond bond : container.getConnectedBondsList(ligand))
        {
            if(bond == ligandBond)
                continue;

            Direction sibling = directions.get(bond);

            if(sibling != null)
                return sibling.readFrom(container.indexOf(bond.getOther(ligand)));
        }

        return null;
    }


    private static boolean hasMarker(IAtomContainer container, IAtom atom, IBond stereoBond,
            Map<IBond, Direction> directions)
    {
        for(IBond bond : container.getConnectedBondsList(atom))
            if(bond != stereoBond && directions.containsKey(bond))
                return true;

        return false;
    }


    private static boolean isStereoBondAtom(IAtomContainer container, IAtom atom)
    {
        for(@SuppressWarnings("rawtypes")
        IStereoElement element : container.stereoElements())
            if(element instanceof IDoubleBondStereochemistry
                    && ((IDoubleBondStereochemistry) element).getStereoBond().contains(atom))
                return true;

        return false;
    }


    private static int valueOf(Integer value)
    {
        return value == null ? 0 : value;
    }


    private static class Direction
    {
        final int from;
        final int to;
        final BondStereo stereo;

        Direction(int from, int to, BondStereo stereo)
        {
            this.from = from;
            this.to = to;
            this.stereo = stereo;
        }

        BondStereo readFrom(int atom)
        {
            return atom == from ? stereo : stereo.inverse();
        }
    }
}
