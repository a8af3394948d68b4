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
package cz.iocb.cansmi.smiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import cz.iocb.cansmi.label.CanonicalLabels;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.stereo.DoubleBondConfigurations;



/**
 * Writes the symbol of a bond traversed from one atom to another.
 */
public class BondSymbols
{
    public static String symbol(Molecule component, CanonicalLabels labels, Bond bond, int from, int to)
    {
        Atom source = component.getAtom(from);
        Atom target = component.getAtom(to);

        if(source.isAromatic() && target.isAromatic())
        {
            if(bond.getOrder() == BondOrder.AROMATIC)
                return "";

            if(bond.getOrder() == BondOrder.SINGLE)
                return "-";
        }

        switch(bond.getOrder())
        {
            case DOUBLE:
                return "=";
            case TRIPLE:
                return "#";
            case AROMATIC:
                return "";
            default:
                return directional(component, labels, bond, from);
        }
    }


    /**
     * Writes the marker of a single bond. Around a configured double bond only the substituent with the lowest label
     * is marked; when it lacks a marker, the marker is derived from a marked sibling of the same carbon. A bond between
     * two double bonds is marked when it is the lowest substituent at either of its carbons.
     */
    private static String directional(Molecule component, CanonicalLabels labels, Bond bond, int from)
    {
        boolean nearDoubleBond = false;

        for(int carbon : new int[] { from, bond.getOther(from) })
        {
            if(component.getDoubleBondOf(carbon) != null)
                nearDoubleBond = true;

            if(DoubleBondConfigurations.configuredDoubleBondOf(component, carbon) == null)
                continue;

            List<Bond> substituents = substituents(component, labels, carbon);

            if(substituents.get(0).key() != bond.key())
                continue;

            if(bond.hasDirection())
                return direction(bond.getStereo(), bond.getAtom1() == from);

            Bond reference = firstMarked(substituents);
            boolean sameOrientation = (reference.getAtom1() == carbon) == (bond.getAtom1() == carbon);
            BondStereo derived = sameOrientation ? reference.getStereo().inverse() : reference.getStereo();

            return direction(derived, bond.getAtom1() == from);
        }

        if(nearDoubleBond || !bond.hasDirection())
            return "";

        return direction(bond.getStereo(), bond.getAtom1() == from);
    }


    private static List<Bond> substituents(Molecule component, final CanonicalLabels labels, final int carbon)
    {
        List<Bond> substituents = new ArrayList<Bond>();

        for(Bond bond : component.getBondsOf(carbon))
            if(bond.getOrder() == BondOrder.SINGLE)
                substituents.add(bond);

        Collections.sort(substituents, new Comparator<Bond>()
        {
            @Override
            public int compare(Bond a, Bond b)
            {
                int atomA = a.getOther(carbon);
                int atomB = b.getOther(carbon);
                int cmp = labels.compare(atomA, atomB);

                if(cmp != 0)
                    return cmp;

                return Integer.compare(atomA, atomB);
            }
        });

        return substituents;
    }


    private static Bond firstMarked(List<Bond> bonds)
    {
        for(Bond bond : bonds)
            if(bond.hasDirection())
                return bond;

        return null;
    }


    private static String direction(BondStereo stereo, boolean forward)
    {
        if(stereo == BondStereo.UP)
            return forward ? "/" : "\\";
        else
            return forward ? "\\" : "/";
    }
}
