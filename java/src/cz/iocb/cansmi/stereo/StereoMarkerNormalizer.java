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
import java.util.List;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Molecule;



/**
 * Rewrites double bond configurations whose directional markers are all {@link BondStereo#DOWN} to the equivalent
 * configuration with all markers {@link BondStereo#UP}.
 */
public class StereoMarkerNormalizer
{
    public static Molecule normalize(Molecule molecule)
    {
        Molecule current = molecule;

        for(Bond doubleBond : molecule.getBonds())
        {
            if(doubleBond.getOrder() != BondOrder.DOUBLE)
                continue;

            List<Bond> first = DoubleBondConfigurations.markedSubstituents(current, doubleBond.getAtom1());
            List<Bond> second = DoubleBondConfigurations.markedSubstituents(current, doubleBond.getAtom2());

            if(first.isEmpty() || second.isEmpty())
                continue;

            List<Bond> marked = new ArrayList<Bond>(first);
            marked.addAll(second);

            if(!allDown(marked) || sharedWithOtherDoubleBond(current, marked, doubleBond))
                continue;

            List<Bond> bonds = new ArrayList<Bond>(current.getBondCount());

            for(Bond bond : current.getBonds())
                bonds.add(marked.contains(bond) ? bond.withStereo(BondStereo.UP) : bond);

            current = current.withBonds(bonds);
        }

        return current;
    }


    private static boolean allDown(List<Bond> bonds)
    {
        for(Bond bond : bonds)
            if(bond.getStereo() != BondStereo.DOWN)
                return false;

        return true;
    }


    /**
     * Tests whether one of the marked bonds also encodes the configuration of another configured double bond, which
     * flipping would change. Double bonds without markers on both ends, such as a neighbouring C=O, do not count.
     */
    private static boolean sharedWithOtherDoubleBond(Molecule molecule, List<Bond> marked, Bond doubleBond)
    {
        for(Bond bond : marked)
        {
            for(int atom : new int[] { bond.getAtom1(), bond.getAtom2() })
                for(Bond other : molecule.getBondsOf(atom))
                    if(other.key() != doubleBond.key() && DoubleBondConfigurations.isConfigured(molecule, other))
                        return true;
        }

        return false;
    }
}
