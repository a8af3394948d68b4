package cz.iocb.cansmi.stereo;

import cz.iocb.cansmi.molecule.Molecule;



/**
 * Downgrades stereo descriptors which cannot describe a real stereo element to none.
 */
public interface StereoValidator
{
    public Molecule validate(Molecule molecule);
}
