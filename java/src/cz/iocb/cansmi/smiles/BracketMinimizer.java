package cz.iocb.cansmi.smiles;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.shared.ImplicitHydrogens;



/**
 * Clears the bracket flag of atoms that are written identically without brackets.
 */
public class BracketMinimizer
{
    public static Molecule minimize(Molecule molecule)
    {
        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());
        boolean changed = false;

        for(Atom atom : molecule.getAtoms())
        {
            if(atom.isBracket() && isRedundant(molecule, atom))
            {
                atoms.add(atom.withBracket(false));
                changed = true;
            }
            else
            {
                atoms.add(atom);
            }
        }

        return changed ? molecule.withAtoms(atoms) : molecule;
    }


    private static boolean isRedundant(Molecule molecule, Atom atom)
    {
        return !atom.hasChirality() && atom.getIsotope() == 0 && atom.getCharge() == 0 && atom.getAtomClass() == 0
                && ImplicitHydrogens.hasDefaultCount(molecule, atom);
    }
}
