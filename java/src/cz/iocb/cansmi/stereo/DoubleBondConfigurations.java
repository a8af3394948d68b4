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
import cz.iocb.cansmi.molecule.Molecule;



/**
 * Locates double bonds which carry a cis/trans configuration. A double bond is configured when both of its ends have
 * a single bond with a directional marker; a marker on one end alone encodes nothing.
 */
public class DoubleBondConfigurations
{
    public static boolean isConfigured(Molecule molecule, Bond bond)
    {
        return bond.getOrder() == BondOrder.DOUBLE && !markedSubstituents(molecule, bond.getAtom1()).isEmpty()
                && !markedSubstituents(molecule, bond.getAtom2()).isEmpty();
    }


    /**
     * Returns the configured double bond of the given atom, or null when the atom has none.
     */
    public static Bond configuredDoubleBondOf(Molecule molecule, int atom)
    {
        for(Bond bond : molecule.getBondsOf(atom))
            if(isConfigured(molecule, bond))
                return bond;

        return null;
    }


    public static List<Bond> markedSubstituents(Molecule molecule, int atom)
    {
        List<Bond> marked = new ArrayList<Bond>();

        for(Bond bond : molecule.getBondsOf(atom))
            if(bond.getOrder() == BondOrder.SINGLE && bond.hasDirection())
                marked.add(bond);

        return marked;
    }
}
