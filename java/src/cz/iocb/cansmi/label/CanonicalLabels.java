package cz.iocb.cansmi.label;

import java.util.Collections;
import java.util.Map;
import java.util.Set;



/**
 * Canonical labels of the atoms of one molecule (or one connected component of it).
 */
public final class CanonicalLabels
{
    private final Map<Integer, Integer> labels;
    private final Set<Integer> symmetricAtoms;
    private final int rounds;


    CanonicalLabels(Map<Integer, Integer> labels, Set<Integer> symmetricAtoms, int rounds)
    {
        this.labels = Collections.unmodifiableMap(labels);
        this.symmetricAtoms = Collections.unmodifiableSet(symmetricAtoms);
        this.rounds = rounds;
    }


    public int getLabel(int atom)
    {
        Integer label = labels.get(atom);

        if(label == null)
            throw new IllegalArgumentException("atom " + atom + " has no canonical label");

        return label;
    }


    public int compare(int atom1, int atom2)
    {
        return Integer.compare(getLabel(atom1), getLabel(atom2));
    }


    public Map<Integer, Integer> getLabels()
    {
        return labels;
    }


    /**
     * Returns the atoms which share their label with at least one other atom.
     */
    public Set<Integer> getSymmetricAtoms()
    {
        return symmetricAtoms;
    }


    public boolean isSymmetric(int atom)
    {
        return symmetricAtoms.contains(atom);
    }


    /**
     * Returns the number of refinement rounds performed.
     */
    public int getRounds()
    {
        return rounds;
    }


    @Override
    public String toString()
    {
        return labels.toString();
    }
}
