package cz.iocb.cansmi.aromaticity;

import cz.iocb.cansmi.molecule.Molecule;



/**
 * Assigns aromatic flags to atoms and aromatic orders to bonds. Implementations return a new molecule and leave the
 * argument untouched.
 */
public interface AromaticityPerception
{
    public Molecule perceive(Molecule molecule);
}
