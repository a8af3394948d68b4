package cz.iocb.cansmi.smiles;

import static org.junit.Assert.assertEquals;
import org.junit.Test;
import cz.iocb.cansmi.label.CanonicalLabeler;
import cz.iocb.cansmi.label.CanonicalLabels;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Molecule;



public class BondSymbolsTest
{
    private static String symbol(Molecule molecule, int from, int to)
    {
        CanonicalLabels labels = CanonicalLabeler.identity(molecule);
        Bond bond = molecule.getBond(from, to);

        return BondSymbols.symbol(molecule, labels, bond, from, to);
    }


    @Test
    public void plainOrders()
    {
        Molecule molecule = Molecule.builder().atom(0, "C", 3).atom(1, "C", 0).atom(2, "C", 0).atom(3, "C", 1)
                .atom(4, "O", 0).bond(0, 1, BondOrder.SINGLE).bond(1, 2, BondOrder.TRIPLE)
                .bond(2, 3, BondOrder.SINGLE).bond(3, 4, BondOrder.DOUBLE).build();

        assertEquals("", symbol(molecule, 0, 1));
        assertEquals("#", symbol(molecule, 1, 2));
        assertEquals("=", symbol(molecule, 4, 3));
    }


    @Test
    public void bondsBetweenAromaticAtoms()
    {
        Molecule molecule = Molecule.builder().aromaticAtom(0, "C", 1).aromaticAtom(1, "C", 1)
                .aromaticAtom(2, "C", 0).aromaticAtom(3, "C", 0).bond(0, 1, BondOrder.AROMATIC)
                .bond(1, 2, BondOrder.AROMATIC).bond(2, 3, BondOrder.SINGLE).build();

        assertEquals("", symbol(molecule, 0, 1));
        assertEquals("-", symbol(molecule, 2, 3));
    }


    @Test
    public void directionDependsOnTheWrittenOrder()
    {
        Molecule molecule = Molecule.builder().atom(0, "F", 0).atom(1, "C", 1).atom(2, "C", 1).atom(3, "F", 0)
                .bond(0, 1, BondOrder.SINGLE, BondStereo.UP).bond(1, 2, BondOrder.DOUBLE)
                .bond(2, 3, BondOrder.SINGLE, BondStereo.DOWN).build();

        assertEquals("/", symbol(molecule, 0, 1));
        assertEquals("\\", symbol(molecule, 1, 0));
        assertEquals("\\", symbol(molecule, 2, 3));
        assertEquals("/", symbol(molecule, 3, 2));
    }


    @Test
    public void onlyTheLowestSubstituentIsMarked()
    {
        // F and Cl on the same carbon; only Cl carries a marker in the input
        Molecule molecule = Molecule.builder().atom(0, "F", 0).atom(1, "Cl", 0).atom(2, "C", 0).atom(3, "C", 1)
                .atom(4, "F", 0).bond(0, 2, BondOrder.SINGLE).bond(1, 2, BondOrder.SINGLE, BondStereo.UP)
                .bond(2, 3, BondOrder.DOUBLE).bond(3, 4, BondOrder.SINGLE, BondStereo.UP).build();

        assertEquals("\\", symbol(molecule, 0, 2));
        assertEquals("", symbol(molecule, 2, 1));
    }


    @Test
    public void bondBetweenDoubleBondsIsMarkedFromEitherCarbon()
    {
        // Cl/C=C/C(F)=C/Cl: the middle bond ranks after F at atom 4 but is the only substituent of atom 3
        Molecule molecule = Molecule.builder().atom(0, "F", 0).atom(1, "Cl", 0).atom(2, "C", 1).atom(3, "C", 1)
                .atom(4, "C", 0).atom(5, "C", 1).atom(6, "Cl", 0).bond(1, 2, BondOrder.SINGLE, BondStereo.UP)
                .bond(2, 3, BondOrder.DOUBLE).bond(3, 4, BondOrder.SINGLE, BondStereo.UP).bond(0, 4, BondOrder.SINGLE)
                .bond(4, 5, BondOrder.DOUBLE).bond(5, 6, BondOrder.SINGLE, BondStereo.UP).build();

        assertEquals("\\", symbol(molecule, 4, 3));
        assertEquals("/", symbol(molecule, 4, 0));
    }


    @Test
    public void unconfiguredCarbonylDoesNotHideTheMarker()
    {
        // NC(=O)/C=C/C: the amide carbon ranks N first, but its C=O carries no configuration
        Molecule molecule = Molecule.builder().atom(0, "O", 0).atom(1, "N", 2).atom(2, "C", 0).atom(3, "C", 1)
                .atom(4, "C", 1).atom(5, "C", 3).bond(0, 2, BondOrder.DOUBLE).bond(1, 2, BondOrder.SINGLE)
                .bond(2, 3, BondOrder.SINGLE, BondStereo.UP).bond(3, 4, BondOrder.DOUBLE)
                .bond(4, 5, BondOrder.SINGLE, BondStereo.UP).build();

        assertEquals("/", symbol(molecule, 2, 3));
        assertEquals("", symbol(molecule, 2, 1));
        assertEquals("/", symbol(molecule, 4, 5));
    }


    @Test
    public void eitherIsNotWritten()
    {
        Molecule molecule = Molecule.builder().atom(0, "F", 0).atom(1, "C", 1).atom(2, "C", 1).atom(3, "F", 0)
                .bond(0, 1, BondOrder.SINGLE, BondStereo.EITHER).bond(1, 2, BondOrder.DOUBLE)
                .bond(2, 3, BondOrder.SINGLE).build();

        assertEquals("", symbol(molecule, 0, 1));
    }
}
