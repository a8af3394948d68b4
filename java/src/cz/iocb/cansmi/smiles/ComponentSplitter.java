package cz.iocb.cansmi.smiles;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.Molecule;



public class ComponentSplitter
{
    /**
     * Returns the atom ids of the connected components. Components are ordered by their first atom in the input order.
     */
    public static List<List<Integer>> split(Molecule molecule)
    {
        List<List<Integer>> components = new ArrayList<List<Integer>>();
        Set<Integer> visited = new HashSet<Integer>();

        for(Atom start : molecule.getAtoms())
        {
            if(!visited.add(start.getId()))
                continue;

            List<Integer> component = new ArrayList<Integer>();
            Deque<Integer> queue = new ArrayDeque<Integer>();
            queue.add(start.getId());

            while(!queue.isEmpty())
            {
                int atom = queue.poll();
                component.add(atom);

                for(Bond bond : molecule.getBondsOf(atom))
                {
                    int other = bond.getOther(atom);

                    if(visited.add(other))
                        queue.add(other);
                }
            }

            components.add(component);
        }

        return components;
    }
}
