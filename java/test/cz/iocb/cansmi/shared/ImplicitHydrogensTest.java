package cz.iocb.cansmi.shared;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.Molecule;



public class ImplicitHydrogensTest
{
    @Test
    public void isolatedAtoms()
    {
        Molecule molecule = Molecule.builder().atom(0, "C", 4).atom(1, "O", 2).atom(2, "Cl", 1).build();

        assertEquals(4, ImplicitHydrogens.defaultCount(molecule, molecule.getAtom(0)));
        assertEquals(2, ImplicitHydrogens.defaultCount(molecule, molecule.getAtom(1)));
        assertEquals(1, ImplicitHydrogens.defaultCount(molecule, molecule.getAtom(2)));
    }


    @Test
    public void higherValenceIsUsedWhenTheLowerIsExceeded()
    {
        // dimethyl sulfoxide
        Molecule molecule = Molecule.builder().atom(0, "C", 3).atom(1, "S", 0).atom(2, "C", 3).atom(3, "O", 0)
                .bond(0, 1, BondOrder.SINGLE).bond(1, 2, BondOrder.SINGLE).bond(1, 3, BondOrder.DOUBLE).build();

        assertEquals(0, ImplicitHydrogens.defaultCount(molecule, molecule.getAtom(1)));
        assertTrue(ImplicitHydrogens.hasDefaultCount(molecule, molecule.getAtom(1)));
    }


    @Test
    public void aromaticAtoms()
    {
        Molecule.Builder builder = Molecule.builder().aromaticAtom(0, "N", 1);

        for(int i = 1; i < 5; i++)
            builder.aromaticAtom(i, "C", 1);

        for(int i = 0; i < 5; i++)
            builder.bond(i, (i + 1) % 5, BondOrder.AROMATIC);

        Molecule pyrrole = builder.build();

        assertEquals(1, ImplicitHydrogens.defaultCount(pyrrole, pyrrole.getAtom(1)));
        assertEquals(0, ImplicitHydrogens.defaultCount(pyrrole, pyrrole.getAtom(0)));
        assertFalse(ImplicitHydrogens.hasDefaultCount(pyrrole, pyrrole.getAtom(0)));
    }


    @Test
    public void aromaticBondCountsAsSingleBond()
    {
        Molecule.Builder builder = Molecule.builder().atom(6, "C", 3);

        for(int i = 0; i < 6; i++)
            builder.aromaticAtom(i, "C", i == 0 ? 0 : 1).bond(i, (i + 1) % 6, BondOrder.AROMATIC);

        Molecule toluene = builder.bond(0, 6, BondOrder.SINGLE).build();

        assertEquals(1, BondOrder.AROMATIC.getValence());
        assertEquals(0, ImplicitHydrogens.defaultCount(toluene, toluene.getAtom(0)));
        assertEquals(1, ImplicitHydrogens.defaultCount(toluene, toluene.getAtom(1)));
        assertEquals(3, ImplicitHydrogens.defaultCount(toluene, toluene.getAtom(6)));
    }


    @Test
    public void atomsOutsideOrganicSubset()
    {
        Atom sodium = new Atom(0, "Na", 11, 0);
        Molecule molecule = Molecule.builder().atom(sodium).build();

        assertFalse(ImplicitHydrogens.isOrganicSubset(sodium));
        assertEquals(-1, ImplicitHydrogens.defaultCount(molecule, sodium));
        assertFalse(ImplicitHydrogens.isOrganicSubset(new Atom(1, "Cl", 17, 0).withAromatic(true)));
    }
}
