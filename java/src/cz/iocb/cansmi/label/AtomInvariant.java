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
package cz.iocb.cansmi.label;

import java.util.List;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.rings.RingInfo;
import cz.iocb.cansmi.shared.AtomicNumbers;
import cz.iocb.cansmi.shared.Settings;



/**
 * Static invariant of an atom. Invariants are compared field by field in the order of declaration; a smaller
 * invariant gives a smaller canonical label.
 */
public final class AtomInvariant implements Comparable<AtomInvariant>
{
    private static final int CARBON_PRIORITY = 1000;
    private static final int OTHER_HETEROATOM_PRIORITY = 100;

    private final int heteroatomPriority;
    private final int absoluteCharge;
    private final int ringCount;
    private final int smallestRing;
    private final int degree;
    private final int orderSum;
    private final int atomicNumber;
    private final int isotope;
    private final int hydrogens;
    private final boolean aromatic;


    public AtomInvariant(int heteroatomPriority, int absoluteCharge, int ringCount, int smallestRing, int degree,
            int orderSum, int atomicNumber, int isotope, int hydrogens, boolean aromatic)
    {
        this.heteroatomPriority = heteroatomPriority;
        this.absoluteCharge = absoluteCharge;
        this.ringCount = ringCount;
        this.smallestRing = smallestRing;
        this.degree = degree;
        this.orderSum = orderSum;
        this.atomicNumber = atomicNumber;
        this.isotope = isotope;
        this.hydrogens = hydrogens;
        this.aromatic = aromatic;
    }


    public static AtomInvariant of(Molecule molecule, Atom atom, RingInfo rings)
    {
        List<List<Integer>> atomRings = rings.getRingsContainingAtom(atom.getId());
        int smallestRing = Settings.nonRingSize;

        for(List<Integer> ring : atomRings)
            smallestRing = Math.min(smallestRing, ring.size());

        return new AtomInvariant(heteroatomPriority(atom.getAtomicNumber()), Math.abs(atom.getCharge()),
                atomRings.size(), smallestRing, molecule.getDegree(atom.getId()),
                molecule.getDoubledOrderSum(atom.getId()), atom.getAtomicNumber(), atom.getIsotope(),
                atom.getHydrogens(), atom.isAromatic());
    }


    /**
     * Nitrogen comes first, then oxygen, sulfur, phosphorus, the other heteroatoms by atomic number, and carbon last.
     */
    static int heteroatomPriority(int atomicNumber)
    {
        switch(atomicNumber)
        {
            case AtomicNumbers.N:
                return 1;
            case AtomicNumbers.O:
                return 2;
            case AtomicNumbers.S:
                return 3;
            case AtomicNumbers.P:
                return 4;
            case AtomicNumbers.C:
                return CARBON_PRIORITY;
            default:
                return OTHER_HETEROATOM_PRIORITY + atomicNumber;
        }
    }


    @Override
    public int compareTo(AtomInvariant other)
    {
        int result = Integer.compare(heteroatomPriority, other.heteroatomPriority);

        if(result == 0)
            result = Integer.compare(absoluteCharge, other.absoluteCharge);

        if(result == 0)
            result = Integer.compare(ringCount, other.ringCount);

        if(result == 0)
            result = Integer.compare(smallestRing, other.smallestRing);

        if(result == 0)
            result = Integer.compare(degree, other.degree);

        // inverted: atoms carrying multiple bonds sort first
        if(result == 0)
            result = Integer.compare(other.orderSum, orderSum);

        if(result == 0)
            result = Integer.compare(atomicNumber, other.atomicNumber);

        if(result == 0)
            result = Integer.compare(isotope, other.isotope);

        if(result == 0)
            result = Integer.compare(hydrogens, other.hydrogens);

        if(result == 0)
            result = Boolean.compare(other.aromatic, aromatic);

        return result;
    }


    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof AtomInvariant && compareTo((AtomInvariant) obj) == 0;
    }


    @Override
    public int hashCode()
    {
        int hash = heteroatomPriority;
        hash = 31 * hash + absoluteCharge;
        hash = 31 * hash + ringCount;
        hash = 31 * hash + smallestRing;
        hash = 31 * hash + degree;
        hash = 31 * hash + orderSum;
        hash = 31 * hash + atomicNumber;
        hash = 31 * hash + isotope;
        hash = 31 * hash + hydrogens;
        hash = 31 * hash + (aromatic ? 1 : 0);

        return hash;
    }


    @Override
    public String toString()
    {
        return "[" + heteroatomPriority + "|" + absoluteCharge + "|" + ringCount + "|" + smallestRing + "|" + degree
                + "|" + orderSum + "|" + atomicNumber + "|" + isotope + "|" + hydrogens + "|"
                + (aromatic ? "ar" : "al") + "]";
    }
}
