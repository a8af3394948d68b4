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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.rings.RingInfo;
import cz.iocb.cansmi.shared.Settings;



/**
 * Computes canonical atom labels by ranking static atom invariants and refining the ranks with the ranks of the
 * neighbours (one dimensional colour refinement) until they stop changing or the round budget is exhausted.
 *
 * Labels are dense: they run from 1 to the number of distinct classes. Symmetry-equivalent atoms share a label.
 */
public class CanonicalLabeler
{
    private static final Logger LOGGER = LogManager.getLogger(CanonicalLabeler.class);

    private final int maximumRounds;


    public CanonicalLabeler()
    {
        this(Settings.maximumRefinementRounds);
    }


    public CanonicalLabeler(int maximumRounds)
    {
        if(maximumRounds < 0)
            throw new IllegalArgumentException("negative round budget");

        this.maximumRounds = maximumRounds;
    }


    public CanonicalLabels label(Molecule molecule, RingInfo rings)
    {
        List<Atom> atoms = molecule.getAtoms();
        int count = atoms.size();

        Map<Integer, Integer> indexes = new HashMap<Integer, Integer>();

        for(int i = 0; i < count; i++)
            indexes.put(atoms.get(i).getId(), i);

        List<AtomInvariant> invariants = new ArrayList<AtomInvariant>(count);

        for(Atom atom : atoms)
            invariants.add(AtomInvariant.of(molecule, atom, rings));

        int[] ranks = denseRanks(invariants);
        int rounds = 0;

        while(rounds < maximumRounds)
        {
            List<Signature> signatures = new ArrayList<Signature>(count);

            for(int i = 0; i < count; i++)
            {
                int atom = atoms.get(i).getId();
                List<Bond> bonds = molecule.getBondsOf(atom);
                int[] neighbours = new int[bonds.size()];

                for(int j = 0; j < bonds.size(); j++)
                {
                    Bond bond = bonds.get(j);
                    int neighbour = indexes.get(bond.getOther(atom));

                    // pairs (bond rank, neighbour rank) packed so that they sort lexicographically
                    neighbours[j] = bond.getOrder().getRank() * (count + 1) + ranks[neighbour];
                }

                Arrays.sort(neighbours);
                signatures.add(new Signature(ranks[i], neighbours));
            }

            int[] refined = denseRanks(signatures);
            rounds++;

            if(Arrays.equals(ranks, refined))
                break;

            ranks = refined;
        }

        LOGGER.debug("canonical labels of " + count + " atoms computed in " + rounds + " refinement rounds");

        Map<Integer, Integer> labels = new LinkedHashMap<Integer, Integer>();
        Map<Integer, Integer> classSizes = new HashMap<Integer, Integer>();

        for(int i = 0; i < count; i++)
        {
            labels.put(atoms.get(i).getId(), ranks[i]);

            Integer size = classSizes.get(ranks[i]);
            classSizes.put(ranks[i], size == null ? 1 : size + 1);
        }

        Set<Integer> symmetric = new HashSet<Integer>();

        for(int i = 0; i < count; i++)
            if(classSizes.get(ranks[i]) > 1)
                symmetric.add(atoms.get(i).getId());

        return new CanonicalLabels(labels, symmetric, rounds);
    }


    /**
     * Returns labels equal to the atom identifiers, so that a traversal driven by them follows the input numbering.
     */
    public static CanonicalLabels identity(Molecule molecule)
    {
        Map<Integer, Integer> labels = new LinkedHashMap<Integer, Integer>();

        for(Atom atom : molecule.getAtoms())
            labels.put(atom.getId(), atom.getId());

        return new CanonicalLabels(labels, Collections.<Integer>emptySet(), 0);
    }


    static <T extends Comparable<T>> int[] denseRanks(final List<T> keys)
    {
        Integer[] order = new Integer[keys.size()];

        for(int i = 0; i < order.length; i++)
            order[i] = i;

        Arrays.sort(order, new Comparator<Integer>()
        {
            @Override
            public int compare(Integer a, Integer b)
            {
                return keys.get(a).compareTo(keys.get(b));
            }
        });

        int[] ranks = new int[order.length];
        int rank = 0;

        for(int i = 0; i < order.length; i++)
        {
            if(i == 0 || keys.get(order[i - 1]).compareTo(keys.get(order[i])) != 0)
                rank++;

            ranks[order[i]] = rank;
        }

        return ranks;
    }


    private static final class Signature implements Comparable<Signature>
    {
        private final int rank;
        private final int[] neighbours;


        Signature(int rank, int[] neighbours)
        {
            this.rank = rank;
            this.neighbours = neighbours;
        }


        @Override
        public int compareTo(Signature other)
        {
            if(rank != other.rank)
                return Integer.compare(rank, other.rank);

            int length = Math.min(neighbours.length, other.neighbours.length);

            for(int i = 0; i < length; i++)
                if(neighbours[i] != other.neighbours[i])
                    return Integer.compare(neighbours[i], other.neighbours[i]);

            return Integer.compare(neighbours.length, other.neighbours.length);
        }
    }
}
