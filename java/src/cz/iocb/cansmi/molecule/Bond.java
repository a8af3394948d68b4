package cz.iocb.cansmi.molecule;

import java.util.Objects;



/**
 * Immutable bond record. The atom pair is unordered for chemistry, but the stored order gives the direction in which
 * the stereo marker is read.
 */
public final class Bond
{
    private final int atom1;
    private final int atom2;
    private final BondOrder order;
    private final BondStereo stereo;


    public Bond(int atom1, int atom2, BondOrder order, BondStereo stereo)
    {
        if(order == null)
            throw new IllegalArgumentException("bond " + atom1 + "-" + atom2 + " has no order");

        this.atom1 = atom1;
        this.atom2 = atom2;
        this.order = order;
        this.stereo = stereo == null ? BondStereo.NONE : stereo;
    }


    public Bond(int atom1, int atom2, BondOrder order)
    {
        this(atom1, atom2, order, BondStereo.NONE);
    }


    public int getAtom1()
    {
        return atom1;
    }


    public int getAtom2()
    {
        return atom2;
    }


    public BondOrder getOrder()
    {
        return order;
    }


    public BondStereo getStereo()
    {
        return stereo;
    }


    public boolean hasDirection()
    {
        return stereo.isDirectional();
    }


    public boolean contains(int atom)
    {
        return atom1 == atom || atom2 == atom;
    }


    public int getOther(int atom)
    {
        if(atom == atom1)
            return atom2;
        else if(atom == atom2)
            return atom1;

        throw new IllegalArgumentException("atom " + atom + " is not an end of bond " + this);
    }


    /**
     * Returns the key of the unordered atom pair.
     */
    public long key()
    {
        return key(atom1, atom2);
    }


    public static long key(int a, int b)
    {
        int low = Math.min(a, b);
        int high = Math.max(a, b);

        return ((long) low << 32) | (high & 0xffffffffL);
    }


    public Bond withOrder(BondOrder order)
    {
        return new Bond(atom1, atom2, order, stereo);
    }


    public Bond withStereo(BondStereo stereo)
    {
        return new Bond(atom1, atom2, order, stereo);
    }


    @Override
    public boolean equals(Object obj)
    {
        if(this == obj)
            return true;

        if(!(obj instanceof Bond))
            return false;

        Bond other = (Bond) obj;

        return atom1 == other.atom1 && atom2 == other.atom2 && order == other.order && stereo == other.stereo;
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(atom1, atom2, order, stereo);
    }


    @Override
    public String toString()
    {
        return "Bond[" + atom1 + "-" + atom2 + ":" + order + (stereo == BondStereo.NONE ? "" : "," + stereo) + "]";
    }
}
