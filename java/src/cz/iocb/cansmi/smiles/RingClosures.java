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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.cansmi.molecule.Bond;



/**
 * Assignment of ring closure digits to the back edges of a traversal. Digits are numbered from 1 in the order of the
 * preorder positions of the bond ends and are not reused within a component.
 */
public final class RingClosures
{
    private final Map<Integer, List<Closure>> closures;


    private RingClosures(Map<Integer, List<Closure>> closures)
    {
        this.closures = closures;
    }


    public static RingClosures assign(final Traversal traversal)
    {
        List<Bond> backEdges = new ArrayList<Bond>(traversal.getBackEdges());

        Collections.sort(backEdges, new Comparator<Bond>()
        {
            @Override
            public int compare(Bond a, Bond b)
            {
                int cmp = Integer.compare(opening(traversal, a), opening(traversal, b));

                if(cmp != 0)
                    return cmp;

                return Integer.compare(closing(traversal, a), closing(traversal, b));
            }
        });

        Map<Integer, List<Closure>> closures = new HashMap<Integer, List<Closure>>();
        int digit = 1;

        for(Bond bond : backEdges)
        {
            int opening = traversal.getPreorder().get(opening(traversal, bond));
            int closing = traversal.getPreorder().get(closing(traversal, bond));

            add(closures, opening, new Closure(digit, bond, opening, closing));
            add(closures, closing, new Closure(digit, bond, opening, closing));
            digit++;
        }

        return new RingClosures(closures);
    }


    private static int opening(Traversal traversal, Bond bond)
    {
        return Math.min(traversal.getPosition(bond.getAtom1()), traversal.getPosition(bond.getAtom2()));
    }


    private static int closing(Traversal traversal, Bond bond)
    {
        return Math.max(traversal.getPosition(bond.getAtom1()), traversal.getPosition(bond.getAtom2()));
    }


    private static void add(Map<Integer, List<Closure>> closures, int atom, Closure closure)
    {
        List<Closure> list = closures.get(atom);

        if(list == null)
        {
            list = new ArrayList<Closure>();
            closures.put(atom, list);
        }

        list.add(closure);
    }


    /**
     * Returns the closures of the atom in the order of their digits.
     */
    public List<Closure> getClosures(int atom)
    {
        List<Closure> list = closures.get(atom);
        return list == null ? Collections.<Closure>emptyList() : Collections.unmodifiableList(list);
    }


    public static String digitToken(int digit)
    {
        if(digit < 1)
            throw new IllegalArgumentException("invalid ring closure digit " + digit);

        if(digit < 10)
            return Integer.toString(digit);
        else if(digit < 100)
            return "%" + digit;
        else
            return "%(" + digit + ")";
    }


    public static final class Closure
    {
        private final int digit;
        private final Bond bond;
        private final int opening;
        private final int closing;


        Closure(int digit, Bond bond, int opening, int closing)
        {
            this.digit = digit;
            this.bond = bond;
            this.opening = opening;
            this.closing = closing;
        }


        public int getDigit()
        {
            return digit;
        }


        public Bond getBond()
        {
            return bond;
        }


        /**
         * Returns the end written first, which carries the bond symbol.
         */
        public int getOpening()
        {
            return opening;
        }


        public int getClosing()
        {
            return closing;
        }


        public int getPartner(int atom)
        {
            return atom == opening ? closing : opening;
        }
    }
}
