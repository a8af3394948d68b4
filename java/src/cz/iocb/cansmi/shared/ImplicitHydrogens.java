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

import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.Molecule;



/**
 * Default hydrogen counts of the organic subset atoms, i.e. of the atoms which may be written without brackets.
 */
public class ImplicitHydrogens
{
    private static final int[] BORON_VALENCES = { 3 };
    private static final int[] CARBON_VALENCES = { 4 };
    private static final int[] NITROGEN_VALENCES = { 3, 5 };
    private static final int[] OXYGEN_VALENCES = { 2 };
    private static final int[] PHOSPHORUS_VALENCES = { 3, 5 };
    private static final int[] SULFUR_VALENCES = { 2, 4, 6 };
    private static final int[] HALOGEN_VALENCES = { 1 };


    public static boolean isOrganicSubset(Atom atom)
    {
        if(atom.isAromatic())
            return isAromaticSubset(atom.getAtomicNumber());
        else
            return valences(atom.getAtomicNumber()) != null;
    }


    private static boolean isAromaticSubset(int atomicNumber)
    {
        switch(atomicNumber)
        {
            case AtomicNumbers.B:
            case AtomicNumbers.C:
            case AtomicNumbers.N:
            case AtomicNumbers.O:
            case AtomicNumbers.P:
            case AtomicNumbers.S:
                return true;
            default:
                return false;
        }
    }


    private static int[] valences(int atomicNumber)
    {
        switch(atomicNumber)
        {
            case AtomicNumbers.B:
                return BORON_VALENCES;
            case AtomicNumbers.C:
                return CARBON_VALENCES;
            case AtomicNumbers.N:
                return NITROGEN_VALENCES;
            case AtomicNumbers.O:
                return OXYGEN_VALENCES;
            case AtomicNumbers.P:
                return PHOSPHORUS_VALENCES;
            case AtomicNumbers.S:
                return SULFUR_VALENCES;
            case AtomicNumbers.F:
            case AtomicNumbers.Cl:
            case AtomicNumbers.Br:
            case AtomicNumbers.I:
                return HALOGEN_VALENCES;
            default:
                return null;
        }
    }


    /**
     * Returns the number of hydrogens a bracket-free atom of the organic subset would carry at its position in the
     * molecule, or -1 if the atom does not belong to the organic subset.
     */
    public static int defaultCount(Molecule molecule, Atom atom)
    {
        if(!isOrganicSubset(atom))
            return -1;

        int sum = 0;

        for(Bond bond : molecule.getBondsOf(atom.getId()))
            sum += bond.getOrder().getValence();

        if(atom.isAromatic())
        {
            switch(atom.getAtomicNumber())
            {
                case AtomicNumbers.C:
                    return Math.max(0, 3 - sum);
                case AtomicNumbers.B:
                    return Math.max(0, 2 - sum);
                default:
                    return 0;
            }
        }

        for(int valence : valences(atom.getAtomicNumber()))
            if(valence >= sum)
                return valence - sum;

        return 0;
    }


    /**
     * Tests whether the atom can be written without brackets without losing its hydrogen count.
     */
    public static boolean hasDefaultCount(Molecule molecule, Atom atom)
    {
        return defaultCount(molecule, atom) == atom.getHydrogens();
    }
}
