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
package cz.iocb.cansmi.stereo;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.cansmi.label.CanonicalLabeler;
import cz.iocb.cansmi.label.CanonicalLabels;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.rings.RingInfo;
import cz.iocb.cansmi.rings.RingPerception;
import cz.iocb.cansmi.shared.AtomicNumbers;



/**
 * Removes stereo descriptors which are not backed by a real stereo element. Two substituents of a centre are
 * considered identical when they obtain the same canonical label.
 *
 * <p>
 * A tetrahedral centre loses its descriptor when it carries two implicit hydrogens, when it is a neutral nitrogen
 * with three substituents, or when two of its heavy substituents are identical and do not share a ring with the
 * centre. A double bond loses the markers of its adjacent single bonds when one of its ends has two identical
 * substituents, implicit hydrogens included.
 */
public class SymmetryStereoValidator implements StereoValidator
{
    private static final Logger LOGGER = LogManager.getLogger(SymmetryStereoValidator.class);

    private final RingPerception ringPerception;
    private final CanonicalLabeler labeler;


    public SymmetryStereoValidator(RingPerception ringPerception)
    {
        this(ringPerception, new CanonicalLabeler());
    }


    public SymmetryStereoValidator(RingPerception ringPerception, CanonicalLabeler labeler)
    {
        this.ringPerception = ringPerception;
        this.labeler = labeler;
    }


    @Override
    public Molecule validate(Molecule molecule)
    {
        if(!hasStereo(molecule))
            return molecule;

        RingInfo rings = ringPerception.perceive(molecule);
        CanonicalLabels labels = labeler.label(molecule, rings);

        Molecule validated = validateCentres(molecule, labels, rings);
        return validateDoubleBonds(validated, labels);
    }


    private static boolean hasStereo(Molecule molecule)
    {
        for(Atom atom : molecule.getAtoms())
            if(atom.hasChirality())
                return true;

        for(Bond bond : molecule.getBonds())
            if(bond.hasDirection())
                return true;

        return false;
    }


    private static Molecule validateCentres(Molecule molecule, CanonicalLabels labels, RingInfo rings)
    {
        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());
        boolean changed = false;

        for(Atom atom : molecule.getAtoms())
        {
            if(atom.hasChirality() && atom.getChirality().isTetrahedral() && !isCentre(molecule, atom, labels, rings))
            {
                LOGGER.debug("chirality of atom " + atom.getId() + " removed");
                atoms.add(atom.withChirality(null));
                changed = true;
            }
            else
            {
                atoms.add(atom);
            }
        }

        return changed ? molecule.withAtoms(atoms) : molecule;
    }


    private static boolean isCentre(Molecule molecule, Atom atom, CanonicalLabels labels, RingInfo rings)
    {
        if(atom.getHydrogens() > 1)
            return false;

        List<Integer> neighbours = new ArrayList<Integer>();

        for(Bond bond : molecule.getBondsOf(atom.getId()))
            neighbours.add(bond.getOther(atom.getId()));

        if(atom.getAtomicNumber() == AtomicNumbers.N && atom.getCharge() == 0
                && neighbours.size() + atom.getHydrogens() == 3)
            return false;

        for(int i = 0; i < neighbours.size(); i++)
        {
            for(int j = i + 1; j < neighbours.size(); j++)
            {
                int first = neighbours.get(i);
                int second = neighbours.get(j);

                if(labels.getLabel(first) == labels.getLabel(second)
                        && !shareRing(rings, atom.getId(), first, second))
                    return false;
            }
        }

        return true;
    }


    private static boolean shareRing(RingInfo rings, int centre, int first, int second)
    {
        for(List<Integer> ring : rings.getRingsContainingAtom(centre))
            if(ring.contains(first) && ring.contains(second))
                return true;

        return false;
    }


    /**
     * Clears the markers of configured double bonds with two identical groups on one end. A marker which also serves
     * another configured double bond with a real configuration stays. An end without any substituent, such as the
     * oxygen of a C=O, never carries a marker, so it is not a reason to remove anything.
     */
    private static Molecule validateDoubleBonds(Molecule molecule, CanonicalLabels labels)
    {
        Set<Long> needed = new HashSet<Long>();
        Set<Long> invalid = new HashSet<Long>();

        for(Bond doubleBond : molecule.getBonds())
        {
            if(!DoubleBondConfigurations.isConfigured(molecule, doubleBond))
                continue;

            boolean stereogenic = !hasIdenticalGroups(molecule, doubleBond, doubleBond.getAtom1(), labels)
                    && !hasIdenticalGroups(molecule, doubleBond, doubleBond.getAtom2(), labels);

            if(!stereogenic)
                LOGGER.debug("configuration of double bond " + doubleBond + " removed");

            Set<Long> target = stereogenic ? needed : invalid;

            for(int end : new int[] { doubleBond.getAtom1(), doubleBond.getAtom2() })
                for(Bond bond : DoubleBondConfigurations.markedSubstituents(molecule, end))
                    target.add(bond.key());
        }

        invalid.removeAll(needed);

        if(invalid.isEmpty())
            return molecule;

        List<Bond> bonds = new ArrayList<Bond>(molecule.getBondCount());

        for(Bond bond : molecule.getBonds())
            bonds.add(invalid.contains(bond.key()) ? bond.withStereo(BondStereo.NONE) : bond);

        return molecule.withBonds(bonds);
    }


    private static boolean hasIdenticalGroups(Molecule molecule, Bond doubleBond, int end, CanonicalLabels labels)
    {
        List<Integer> substituents = new ArrayList<Integer>();

        for(Bond bond : molecule.getBondsOf(end))
            if(bond.key() != doubleBond.key())
                substituents.add(bond.getOther(end));

        if(molecule.getAtom(end).getHydrogens() > 1)
            return true;

        return substituents.size() == 2
                && labels.getLabel(substituents.get(0)) == labels.getLabel(substituents.get(1));
    }
}
