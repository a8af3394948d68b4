package cz.iocb.cansmi.molecule;



/**
 * Directional marker of a single bond. {@link #UP} is written as "/" and {@link #DOWN} as "\" when the bond is
 * written from its first atom to its second one.
 */
public enum BondStereo
{
    NONE, UP, DOWN, EITHER;


    public boolean isDirectional()
    {
        return this == UP || this == DOWN;
    }


    public BondStereo inverse()
    {
        if(this == UP)
            return DOWN;
        else if(this == DOWN)
            return UP;
        else
            return this;
    }
}
