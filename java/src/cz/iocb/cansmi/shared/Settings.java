package cz.iocb.cansmi.shared;



public class Settings
{
    public static final int maximumRefinementRounds = 8;
    public static final int nonRingSize = 999;
    public static final int rigidRingSizeLimit = 8;
}
