package cz.iocb.cansmi.molecule;



public enum BondOrder
{
    SINGLE(1, 2, 3), DOUBLE(2, 4, 2), TRIPLE(3, 6, 1), AROMATIC(1, 3, 0);

    private final int valence;
    private final int doubledOrder;
    private final int rank;


    private BondOrder(int valence, int doubledOrder, int rank)
    {
        this.valence = valence;
        this.doubledOrder = doubledOrder;
        this.rank = rank;
    }


    /**
     * Returns the contribution of the bond to the valence of its atoms. An aromatic bond counts as a single bond here;
     * the implicit hydrogen rules for aromatic atoms account for its remaining electron.
     */
    public int getValence()
    {
        return valence;
    }


    /**
     * Returns the bond order multiplied by two, so that an aromatic bond (order 1.5) stays integral.
     */
    public int getDoubledOrder()
    {
        return doubledOrder;
    }


    /**
     * Returns the traversal rank of the bond: aromatic bonds rank first (0), then triple, double and single bonds.
     */
    public int getRank()
    {
        return rank;
    }
}
