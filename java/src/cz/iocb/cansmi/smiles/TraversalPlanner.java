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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.cansmi.label.CanonicalLabels;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.shared.AtomicNumbers;



/**
 * Chooses the start atom of a connected component and performs the depth-first walk which determines the spanning
 * tree, the written order of branches and the ring closure bonds.
 */
public class TraversalPlanner
{
    private static final Logger LOGGER = LogManager.getLogger(TraversalPlanner.class);


    public Traversal plan(Molecule component, CanonicalLabels labels)
    {
        if(component.isEmpty())
            throw new IllegalArgumentException("empty component");

        int root = selectRoot(component, labels);

        Map<Integer, Integer> parents = new HashMap<Integer, Integer>();
        Map<Integer, List<Integer>> children = new HashMap<Integer, List<Integer>>();
        Map<Integer, Integer> positions = new HashMap<Integer, Integer>();
        List<Integer> preorder = new ArrayList<Integer>();
        List<Bond> backEdges = new ArrayList<Bond>();
        Set<Long> seenBackEdges = new HashSet<Long>();

        for(Atom atom : component.getAtoms())
            children.put(atom.getId(), new ArrayList<Integer>());

        List<Frame> stack = new ArrayList<Frame>();

        positions.put(root, 0);
        preorder.add(root);
        stack.add(new Frame(root, orderedNeighbours(component, labels, root, null)));

        while(!stack.isEmpty())
        {
            Frame frame = stack.get(stack.size() - 1);

            if(frame.next == frame.neighbours.size())
            {
                stack.remove(stack.size() - 1);
                continue;
            }

            int neighbour = frame.neighbours.get(frame.next++);

            if(positions.containsKey(neighbour))
            {
                Bond bond = component.getBond(frame.atom, neighbour);

                if(seenBackEdges.add(bond.key()))
                    backEdges.add(bond);

                continue;
            }

            parents.put(neighbour, frame.atom);
            children.get(frame.atom).add(neighbour);
            positions.put(neighbour, preorder.size());
            preorder.add(neighbour);
            stack.add(new Frame(neighbour, orderedNeighbours(component, labels, neighbour, frame.atom)));
        }

        if(preorder.size() != component.getAtomCount())
            throw new IllegalStateException("component is not connected");

        if(backEdges.size() != component.getBondCount() - component.getAtomCount() + 1)
            throw new IllegalStateException("found " + backEdges.size() + " ring closures in a component with "
                    + component.getAtomCount() + " atoms and " + component.getBondCount() + " bonds");

        LOGGER.debug("traversal from atom " + root + " with " + backEdges.size() + " ring closures");

        return new Traversal(root, parents, children, preorder, positions, backEdges);
    }


    /**
     * Selects the start atom: the lowest label, then heteroatoms before carbon, terminal atoms, lower degree, lower
     * absolute charge, fewer hydrogens and finally the lower atom id.
     */
    public int selectRoot(final Molecule component, final CanonicalLabels labels)
    {
        List<Atom> atoms = new ArrayList<Atom>(component.getAtoms());

        Collections.sort(atoms, new Comparator<Atom>()
        {
            @Override
            public int compare(Atom a, Atom b)
            {
                int cmp = labels.compare(a.getId(), b.getId());

                if(cmp != 0)
                    return cmp;

                cmp = Boolean.compare(!isHeteroatom(a), !isHeteroatom(b));

                if(cmp != 0)
                    return cmp;

                int degreeA = component.getDegree(a.getId());
                int degreeB = component.getDegree(b.getId());

                cmp = Boolean.compare(degreeA != 1, degreeB != 1);

                if(cmp != 0)
                    return cmp;

                cmp = Integer.compare(degreeA, degreeB);

                if(cmp != 0)
                    return cmp;

                cmp = Integer.compare(Math.abs(a.getCharge()), Math.abs(b.getCharge()));

                if(cmp != 0)
                    return cmp;

                cmp = Integer.compare(a.getHydrogens(), b.getHydrogens());

                if(cmp != 0)
                    return cmp;

                return Integer.compare(a.getId(), b.getId());
            }
        });

        return atoms.get(0).getId();
    }


    private static boolean isHeteroatom(Atom atom)
    {
        return atom.getAtomicNumber() != AtomicNumbers.C && atom.getAtomicNumber() != AtomicNumbers.H;
    }


    private static List<Integer> orderedNeighbours(Molecule component, CanonicalLabels labels, int atom,
            Integer parent)
    {
        List<Integer> neighbours = new ArrayList<Integer>();

        for(Bond bond : component.getBondsOf(atom))
        {
            int other = bond.getOther(atom);

            if(parent == null || other != parent)
                neighbours.add(other);
        }

        Collections.sort(neighbours, new NeighbourComparator(component, labels, atom));

        return neighbours;
    }


    /**
     * Orders the neighbours of one atom: label, bond rank, atomic number, degree, bond order sum (descending),
     * aromatic first, absolute charge and atom id.
     */
    static class NeighbourComparator implements Comparator<Integer>
    {
        private final Molecule component;
        private final CanonicalLabels labels;
        private final int centre;


        NeighbourComparator(Molecule component, CanonicalLabels labels, int centre)
        {
            this.component = component;
            this.labels = labels;
            this.centre = centre;
        }


        @Override
        public int compare(Integer a, Integer b)
        {
            int cmp = labels.compare(a, b);

            if(cmp != 0)
                return cmp;

            cmp = Integer.compare(component.getBond(centre, a).getOrder().getRank(),
                    component.getBond(centre, b).getOrder().getRank());

            if(cmp != 0)
                return cmp;

            Atom atomA = component.getAtom(a);
            Atom atomB = component.getAtom(b);

            cmp = Integer.compare(atomA.getAtomicNumber(), atomB.getAtomicNumber());

            if(cmp != 0)
                return cmp;

            cmp = Integer.compare(component.getDegree(a), component.getDegree(b));

            if(cmp != 0)
                return cmp;

            cmp = Integer.compare(component.getDoubledOrderSum(b), component.getDoubledOrderSum(a));

            if(cmp != 0)
                return cmp;

            cmp = Boolean.compare(!atomA.isAromatic(), !atomB.isAromatic());

            if(cmp != 0)
                return cmp;

            cmp = Integer.compare(Math.abs(atomA.getCharge()), Math.abs(atomB.getCharge()));

            if(cmp != 0)
                return cmp;

            return Integer.compare(a, b);
        }
    }


    private static final class Frame
    {
        private final int atom;
        private final List<Integer> neighbours;
        private int next;


        Frame(int atom, List<Integer> neighbours)
        {
            this.atom = atom;
            this.neighbours = neighbours;
        }
    }
}
