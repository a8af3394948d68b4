package cz.iocb.cansmi.rings;

import java.util.List;



/**
 * Ring membership of the atoms of one molecule. Each ring is a list of atom identifiers in ring order.
 */
public interface RingInfo
{
    public List<List<Integer>> getRings();


    public List<List<Integer>> getRingsContainingAtom(int atom);


    public boolean areBothAtomsInSameRing(int atom1, int atom2);
}
