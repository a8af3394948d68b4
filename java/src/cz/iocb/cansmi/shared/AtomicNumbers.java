package cz.iocb.cansmi.shared;

import org.openscience.cdk.tools.periodictable.PeriodicTable;



public class AtomicNumbers
{
    public static final int H = 1;
    public static final int B = 5;
    public static final int C = 6;
    public static final int N = 7;
    public static final int O = 8;
    public static final int F = 9;
    public static final int P = 15;
    public static final int S = 16;
    public static final int Cl = 17;
    public static final int Br = 35;
    public static final int I = 53;


    public static int of(String symbol)
    {
        Integer number = PeriodicTable.getAtomicNumber(symbol);

        if(number == null || number == 0)
            throw new IllegalArgumentException("unknown element symbol: " + symbol);

        return number;
    }
}
