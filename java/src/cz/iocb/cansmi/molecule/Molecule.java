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
package cz.iocb.cansmi.molecule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import cz.iocb.cansmi.shared.AtomicNumbers;



/**
 * Immutable molecular graph: an ordered list of atoms and an ordered list of bonds between them. The molecule does
 * not have to be connected.
 */
public final class Molecule
{
    private static final Molecule EMPTY = new Molecule(Collections.<Atom>emptyList(), Collections.<Bond>emptyList());

    private final List<Atom> atoms;
    private final List<Bond> bonds;
    private final Map<Integer, Atom> atomsById;
    private final Map<Integer, List<Bond>> bondsByAtom;
    private final Map<Long, Bond> bondsByKey;


    public Molecule(List<Atom> atoms, List<Bond> bonds)
    {
        this.atoms = Collections.unmodifiableList(new ArrayList<Atom>(atoms));
        this.bonds = Collections.unmodifiableList(new ArrayList<Bond>(bonds));
        this.atomsById = new LinkedHashMap<Integer, Atom>();
        this.bondsByAtom = new HashMap<Integer, List<Bond>>();
        this.bondsByKey = new HashMap<Long, Bond>();

        for(Atom atom : this.atoms)
        {
            if(atomsById.put(atom.getId(), atom) != null)
                throw new IllegalArgumentException("duplicate atom id " + atom.getId());

            bondsByAtom.put(atom.getId(), new ArrayList<Bond>());
        }

        for(Bond bond : this.bonds)
        {
            if(!atomsById.containsKey(bond.getAtom1()) || !atomsById.containsKey(bond.getAtom2()))
                throw new IllegalArgumentException("bond " + bond + " references an unknown atom");

            if(bond.getAtom1() == bond.getAtom2())
                throw new IllegalArgumentException("bond " + bond + " connects an atom to itself");

            if(bondsByKey.put(bond.key(), bond) != null)
                throw new IllegalArgumentException("duplicate bond " + bond);

            bondsByAtom.get(bond.getAtom1()).add(bond);
            bondsByAtom.get(bond.getAtom2()).add(bond);
        }
    }


    public static Molecule empty()
    {
        return EMPTY;
    }


    public static Builder builder()
    {
        return new Builder();
    }


    public List<Atom> getAtoms()
    {
        return atoms;
    }


    public List<Bond> getBonds()
    {
        return bonds;
    }


    public int getAtomCount()
    {
        return atoms.size();
    }


    public int getBondCount()
    {
        return bonds.size();
    }


    public boolean isEmpty()
    {
        return atoms.isEmpty();
    }


    public boolean containsAtom(int id)
    {
        return atomsById.containsKey(id);
    }


    public Atom getAtom(int id)
    {
        Atom atom = atomsById.get(id);

        if(atom == null)
            throw new IllegalArgumentException("unknown atom id " + id);

        return atom;
    }


    /**
     * Returns the bonds of the given atom in the order in which they were added to the molecule.
     */
    public List<Bond> getBondsOf(int atom)
    {
        List<Bond> list = bondsByAtom.get(atom);

        if(list == null)
            throw new IllegalArgumentException("unknown atom id " + atom);

        return Collections.unmodifiableList(list);
    }


    /**
     * Returns the bond between the given atoms, or null if they are not bonded.
     */
    public Bond getBond(int atom1, int atom2)
    {
        return bondsByKey.get(Bond.key(atom1, atom2));
    }


    public int getDegree(int atom)
    {
        return getBondsOf(atom).size();
    }


    /**
     * Returns the sum of the bond orders of the given atom, multiplied by two.
     */
    public int getDoubledOrderSum(int atom)
    {
        int sum = 0;

        for(Bond bond : getBondsOf(atom))
            sum += bond.getOrder().getDoubledOrder();

        return sum;
    }


    /**
     * Returns the double bond of the given atom, or null if it has none. When there are more of them, the one added
     * first is returned.
     */
    public Bond getDoubleBondOf(int atom)
    {
        for(Bond bond : getBondsOf(atom))
            if(bond.getOrder() == BondOrder.DOUBLE)
                return bond;

        return null;
    }


    /**
     * Returns the part of the molecule induced by the given atoms. Atoms and bonds keep their relative order.
     */
    public Molecule subMolecule(Collection<Integer> atomIds)
    {
        Set<Integer> selected = new HashSet<Integer>(atomIds);
        List<Atom> subAtoms = new ArrayList<Atom>();
        List<Bond> subBonds = new ArrayList<Bond>();

        for(Atom atom : atoms)
            if(selected.contains(atom.getId()))
                subAtoms.add(atom);

        for(Bond bond : bonds)
            if(selected.contains(bond.getAtom1()) && selected.contains(bond.getAtom2()))
                subBonds.add(bond);

        return new Molecule(subAtoms, subBonds);
    }


    public Molecule withAtoms(List<Atom> newAtoms)
    {
        return new Molecule(newAtoms, bonds);
    }


    public Molecule withBonds(List<Bond> newBonds)
    {
        return new Molecule(atoms, newBonds);
    }


    @Override
    public String toString()
    {
        return "Molecule" + atoms + bonds;
    }


    public static class Builder
    {
        private final List<Atom> atoms = new ArrayList<Atom>();
        private final List<Bond> bonds = new ArrayList<Bond>();


        public Builder atom(Atom atom)
        {
            atoms.add(atom);
            return this;
        }


        /**
         * Adds a neutral aliphatic atom of the given element.
         */
        public Builder atom(int id, String symbol, int hydrogens)
        {
            return atom(new Atom(id, symbol, AtomicNumbers.of(symbol), hydrogens));
        }


        /**
         * Adds a neutral aromatic atom of the given element.
         */
        public Builder aromaticAtom(int id, String symbol, int hydrogens)
        {
            return atom(new Atom(id, symbol, AtomicNumbers.of(symbol), hydrogens).withAromatic(true));
        }


        public Builder bond(Bond bond)
        {
            bonds.add(bond);
            return this;
        }


        public Builder bond(int atom1, int atom2, BondOrder order)
        {
            return bond(new Bond(atom1, atom2, order));
        }


        public Builder bond(int atom1, int atom2, BondOrder order, BondStereo stereo)
        {
            return bond(new Bond(atom1, atom2, order, stereo));
        }


        public Molecule build()
        {
            return new Molecule(atoms, bonds);
        }
    }
}
