package cz.iocb.cansmi.smiles;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import cz.iocb.cansmi.molecule.Bond;



/**
 * Spanning tree of one connected component together with the bonds which close its rings. Children of each atom
 * are stored in the order in which they are written.
 */
public final class Traversal
{
    private final int root;
    private final Map<Integer, Integer> parents;
    private final Map<Integer, List<Integer>> children;
    private final List<Integer> preorder;
    private final Map<Integer, Integer> positions;
    private final List<Bond> backEdges;


    Traversal(int root, Map<Integer, Integer> parents, Map<Integer, List<Integer>> children, List<Integer> preorder,
            Map<Integer, Integer> positions, List<Bond> backEdges)
    {
        this.root = root;
        this.parents = parents;
        this.children = children;
        this.preorder = Collections.unmodifiableList(preorder);
        this.positions = positions;
        this.backEdges = Collections.unmodifiableList(backEdges);
    }


    public int getRoot()
    {
        return root;
    }


    public boolean hasParent(int atom)
    {
        return parents.containsKey(atom);
    }


    /**
     * Returns the parent of the atom in the tree; the root has none.
     */
    public int getParent(int atom)
    {
        Integer parent = parents.get(atom);

        if(parent == null)
            throw new IllegalArgumentException("atom " + atom + " has no parent");

        return parent;
    }


    public List<Integer> getChildren(int atom)
    {
        List<Integer> list = children.get(atom);

        if(list == null)
            throw new IllegalArgumentException("unknown atom id " + atom);

        return Collections.unmodifiableList(list);
    }


    public List<Integer> getPreorder()
    {
        return preorder;
    }


    /**
     * Returns the position of the atom in the depth-first preorder, starting from 0 at the root.
     */
    public int getPosition(int atom)
    {
        Integer position = positions.get(atom);

        if(position == null)
            throw new IllegalArgumentException("unknown atom id " + atom);

        return position;
    }


    public List<Bond> getBackEdges()
    {
        return backEdges;
    }
}
