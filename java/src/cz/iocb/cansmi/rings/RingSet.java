package cz.iocb.cansmi.rings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;



/**
 * {@link RingInfo} over a fixed list of rings.
 */
public class RingSet implements RingInfo
{
    private final List<List<Integer>> rings;
    private final List<Set<Integer>> ringMembers;
    private final Map<Integer, List<List<Integer>>> ringsByAtom;


    public RingSet(List<List<Integer>> rings)
    {
        List<List<Integer>> copy = new ArrayList<List<Integer>>(rings.size());
        this.ringMembers = new ArrayList<Set<Integer>>(rings.size());
        this.ringsByAtom = new HashMap<Integer, List<List<Integer>>>();

        for(List<Integer> ring : rings)
        {
            List<Integer> ringCopy = Collections.unmodifiableList(new ArrayList<Integer>(ring));
            copy.add(ringCopy);
            ringMembers.add(new HashSet<Integer>(ring));

            for(Integer atom : ring)
            {
                List<List<Integer>> list = ringsByAtom.get(atom);

                if(list == null)
                {
                    list = new ArrayList<List<Integer>>();
                    ringsByAtom.put(atom, list);
                }

                list.add(ringCopy);
            }
        }

        this.rings = Collections.unmodifiableList(copy);
    }


    @Override
    public List<List<Integer>> getRings()
    {
        return rings;
    }


    @Override
    public List<List<Integer>> getRingsContainingAtom(int atom)
    {
        List<List<Integer>> list = ringsByAtom.get(atom);

        if(list == null)
            return Collections.emptyList();

        return Collections.unmodifiableList(list);
    }


    @Override
    public boolean areBothAtomsInSameRing(int atom1, int atom2)
    {
        for(Set<Integer> members : ringMembers)
            if(members.contains(atom1) && members.contains(atom2))
                return true;

        return false;
    }
}
