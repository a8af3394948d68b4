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
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.rings.RingInfo;
import cz.iocb.cansmi.shared.Settings;



/**
 * Drops stereo descriptors which are meaningless for structural reasons, independently of the atom symmetry.
 */
public class StereoPruner
{
    private static final Logger LOGGER = LogManager.getLogger(StereoPruner.class);


    public static Molecule prune(Molecule molecule, RingInfo rings)
    {
        return pruneRingDoubleBonds(pruneCentres(molecule), rings);
    }


    /**
     * Removes tetrahedral descriptors of atoms with fewer than three heavy neighbours.
     */
    static Molecule pruneCentres(Molecule molecule)
    {
        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());
        boolean changed = false;

        for(Atom atom : molecule.getAtoms())
        {
            if(atom.hasChirality() && atom.getChirality().isTetrahedral() && molecule.getDegree(atom.getId()) < 3)
            {
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


    /**
     * Removes the markers around double bonds of small rings, which can only have the cis configuration. A marker is
     * kept when it also belongs to an exocyclic double bond.
     */
    static Molecule pruneRingDoubleBonds(Molecule molecule, RingInfo rings)
    {
        Set<Long> cleared = new HashSet<Long>();

        for(Bond doubleBond : molecule.getBonds())
        {
            if(doubleBond.getOrder() != BondOrder.DOUBLE || !inSmallRing(rings, doubleBond))
                continue;

            for(int end : new int[] { doubleBond.getAtom1(), doubleBond.getAtom2() })
            {
                for(Bond bond : molecule.getBondsOf(end))
                {
                    if(!bond.hasDirection() || bond.getOrder() != BondOrder.SINGLE)
                        continue;

                    if(!hasExocyclicDoubleBond(molecule, rings, bond.getOther(end)))
                        cleared.add(bond.key());
                }
            }
        }

        if(cleared.isEmpty())
            return molecule;

        LOGGER.debug("removed " + cleared.size() + " markers around ring double bonds");

        List<Bond> bonds = new ArrayList<Bond>(molecule.getBondCount());

        for(Bond bond : molecule.getBonds())
            bonds.add(cleared.contains(bond.key()) ? bond.withStereo(BondStereo.NONE) : bond);

        return molecule.withBonds(bonds);
    }


    private static boolean inSmallRing(RingInfo rings, Bond bond)
    {
        for(List<Integer> ring : rings.getRingsContainingAtom(bond.getAtom1()))
            if(ring.contains(bond.getAtom2()) && ring.size() < Settings.rigidRingSizeLimit)
                return true;

        return false;
    }


    private static boolean hasExocyclicDoubleBond(Molecule molecule, RingInfo rings, int atom)
    {
        for(Bond bond : molecule.getBondsOf(atom))
            if(bond.getOrder() == BondOrder.DOUBLE && !rings.areBothAtomsInSameRing(atom, bond.getOther(atom)))
                return true;

        return false;
    }
}
