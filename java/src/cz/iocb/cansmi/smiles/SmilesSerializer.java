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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.cansmi.label.CanonicalLabels;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Chirality;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.shared.ImplicitHydrogens;



/**
 * Writes one connected component along a planned traversal.
 *
 * For each atom the serializer writes the atom token, its ring closures and its children; every child except the last
 * one is enclosed in a branch.
 */
public class SmilesSerializer
{
    private static final Logger LOGGER = LogManager.getLogger(SmilesSerializer.class);


    public String serialize(Molecule component, CanonicalLabels labels, Traversal traversal)
    {
        RingClosures closures = RingClosures.assign(traversal);
        StringBuilder builder = new StringBuilder();

        Deque<Item> stack = new ArrayDeque<Item>();
        stack.push(Item.visit(traversal.getRoot()));

        while(!stack.isEmpty())
        {
            Item item = stack.pop();

            if(item.text != null)
            {
                builder.append(item.text);
                continue;
            }

            int atom = item.atom;

            Chirality chirality = writtenChirality(component, traversal, closures, atom);
            appendAtom(builder, component, component.getAtom(atom), chirality);

            for(RingClosures.Closure closure : closures.getClosures(atom))
            {
                if(closure.getOpening() == atom)
                    builder.append(BondSymbols.symbol(component, labels, closure.getBond(), atom,
                            closure.getClosing()));

                builder.append(RingClosures.digitToken(closure.getDigit()));
            }

            List<Integer> children = traversal.getChildren(atom);

            for(int i = children.size() - 1; i >= 0; i--)
            {
                int child = children.get(i);
                String bond = BondSymbols.symbol(component, labels, component.getBond(atom, child), atom, child);

                if(i == children.size() - 1)
                {
                    stack.push(Item.visit(child));
                    stack.push(Item.text(bond));
                }
                else
                {
                    stack.push(Item.text(")"));
                    stack.push(Item.visit(child));
                    stack.push(Item.text("(" + bond));
                }
            }
        }

        return builder.toString();
    }


    /**
     * Returns the chirality as it has to be written for the order in which the neighbours of the atom appear in the
     * output: the parent, the implicit hydrogen, the ring closure partners and the children.
     */
    static Chirality writtenChirality(Molecule component, Traversal traversal, RingClosures closures, int atom)
    {
        Atom centre = component.getAtom(atom);
        Chirality chirality = centre.getChirality();

        if(chirality == null || !chirality.isTetrahedral() || !chirality.hasNeighbourOrder())
            return chirality;

        List<Integer> written = new ArrayList<Integer>();

        if(traversal.hasParent(atom))
            written.add(traversal.getParent(atom));

        if(centre.getHydrogens() > 0)
            written.add(atom);

        for(RingClosures.Closure closure : closures.getClosures(atom))
            written.add(closure.getPartner(atom));

        written.addAll(traversal.getChildren(atom));

        List<Integer> reference = chirality.getNeighbourOrder();

        if(written.size() != reference.size() || !new HashSet<Integer>(written).equals(new HashSet<Integer>(reference)))
        {
            LOGGER.debug("neighbour order of atom " + atom + " does not match its neighbours");
            return chirality;
        }

        return isOddPermutation(reference, written) ? chirality.inverse() : chirality;
    }


    static boolean isOddPermutation(List<Integer> reference, List<Integer> written)
    {
        int[] permutation = new int[written.size()];

        for(int i = 0; i < permutation.length; i++)
            permutation[i] = reference.indexOf(written.get(i));

        int inversions = 0;

        for(int i = 0; i < permutation.length; i++)
            for(int j = i + 1; j < permutation.length; j++)
                if(permutation[i] > permutation[j])
                    inversions++;

        return inversions % 2 == 1;
    }


    static void appendAtom(StringBuilder builder, Molecule component, Atom atom, Chirality chirality)
    {
        String symbol = atom.isAromatic() ? atom.getSymbol().toLowerCase() : atom.getSymbol();

        if(!needsBracket(component, atom))
        {
            builder.append(symbol);
            return;
        }

        builder.append('[');

        if(atom.getIsotope() > 0)
            builder.append(atom.getIsotope());

        builder.append(symbol);

        if(chirality != null)
            builder.append(chirality.toSmiles());

        if(atom.getHydrogens() > 0)
        {
            builder.append('H');

            if(atom.getHydrogens() > 1)
                builder.append(atom.getHydrogens());
        }

        int charge = atom.getCharge();

        if(charge != 0)
        {
            builder.append(charge > 0 ? '+' : '-');

            if(Math.abs(charge) > 1)
                builder.append(Math.abs(charge));
        }

        if(atom.getAtomClass() > 0)
            builder.append(':').append(atom.getAtomClass());

        builder.append(']');
    }


    /**
     * Tests whether the atom has to be written in brackets. Besides the explicit flag, this is the case for any
     * property the bare organic subset symbol cannot express, including a non-default hydrogen count.
     */
    static boolean needsBracket(Molecule component, Atom atom)
    {
        return atom.isBracket() || atom.getIsotope() > 0 || atom.getCharge() != 0 || atom.getAtomClass() > 0
                || atom.hasChirality() || !ImplicitHydrogens.hasDefaultCount(component, atom);
    }


    private static final class Item
    {
        private final String text;
        private final int atom;


        private Item(String text, int atom)
        {
            this.text = text;
            this.atom = atom;
        }


        static Item text(String text)
        {
            return new Item(text, -1);
        }


        static Item visit(int atom)
        {
            return new Item(null, atom);
        }
    }
}
