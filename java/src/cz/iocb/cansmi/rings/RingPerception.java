package cz.iocb.cansmi.rings;

import cz.iocb.cansmi.molecule.Molecule;



public interface RingPerception
{
    public RingInfo perceive(Molecule molecule);
}
