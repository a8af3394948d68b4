package cz.iocb.cansmi.shared;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import org.junit.Test;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Chirality;
import cz.iocb.cansmi.molecule.Molecule;



public class MoleculeCreatorTest
{
    static final String ETHANOL_MOLFILE = "ethanol\n" + "  test\n" + "\n"
            + "  3  2  0  0  0  0  0  0  0  0999 V2000\n"
            + "    0.0000    0.0000    0.0000 C   0  0  0  0  0  0  0  0  0  0  0  0\n"
            + "    1.2990    0.7500    0.0000 C   0  0  0  0  0  0  0  0  0  0  0  0\n"
            + "    2.5981    0.0000    0.0000 O   0  0  0  0  0  0  0  0  0  0  0  0\n"
            + "  1  2  1  0  0  0  0\n" + "  2  3  1  0  0  0  0\n" + "M  END\n";


    @Test
    public void aromaticSmiles() throws Exception
    {
        Molecule pyrrole = MoleculeCreator.readSmiles("[nH]1cccc1");

        assertEquals(5, pyrrole.getAtomCount());
        assertTrue(pyrrole.getAtom(0).isAromatic());
        assertEquals(1, pyrrole.getAtom(0).getHydrogens());
        assertTrue(pyrrole.getAtom(0).isBracket());
        assertFalse(pyrrole.getAtom(1).isBracket());
        assertEquals(BondOrder.AROMATIC, pyrrole.getBond(0, 1).getOrder());
    }


    @Test
    public void kekuleSmilesIsPerceivedAromatic() throws Exception
    {
        Molecule benzene = MoleculeCreator.readSmiles("C1=CC=CC=C1");

        for(Atom atom : benzene.getAtoms())
            assertTrue(atom.isAromatic());
    }


    @Test
    public void bracketWithDefaultHydrogensIsDropped() throws Exception
    {
        assertFalse(MoleculeCreator.readSmiles("[CH4]").getAtom(0).isBracket());
        assertTrue(MoleculeCreator.readSmiles("[CH3]").getAtom(0).isBracket());
    }


    @Test
    public void isotopeChargeAndClass() throws Exception
    {
        Molecule molecule = MoleculeCreator.readSmiles("[13CH3:7][NH3+]");

        assertEquals(13, molecule.getAtom(0).getIsotope());
        assertEquals(7, molecule.getAtom(0).getAtomClass());
        assertEquals(1, molecule.getAtom(1).getCharge());
        assertEquals(3, molecule.getAtom(1).getHydrogens());
    }


    @Test
    public void tetrahedralStereo() throws Exception
    {
        Molecule molecule = MoleculeCreator.readSmiles("C[C@H](O)N");
        Chirality chirality = molecule.getAtom(1).getChirality();

        assertTrue(chirality.isTetrahedral());
        assertFalse(chirality.isClockwise());
        assertEquals(Arrays.asList(0, 1, 2, 3), chirality.getNeighbourOrder());
        assertNull(molecule.getAtom(0).getChirality());
    }


    @Test
    public void doubleBondStereo() throws Exception
    {
        Molecule trans = MoleculeCreator.readSmiles("F/C=C/F");
        Molecule cis = MoleculeCreator.readSmiles("F/C=C\\F");

        assertEquals(BondStereo.UP, trans.getBond(0, 1).getStereo());
        assertEquals(BondStereo.UP, trans.getBond(2, 3).getStereo());
        assertEquals(BondStereo.UP, cis.getBond(0, 1).getStereo());
        assertEquals(BondStereo.DOWN, cis.getBond(2, 3).getStereo());
    }


    @Test
    public void conjugatedDoubleBondsShareConsistentMarkers() throws Exception
    {
        Molecule molecule = MoleculeCreator.readSmiles("Cl/C=C/C(/F)=C/Cl");

        Bond shared = molecule.getBond(2, 3);
        Bond fluorine = molecule.getBond(3, 4);

        assertTrue(shared.hasDirection());
        assertTrue(molecule.getBond(0, 1).hasDirection());
        assertTrue(molecule.getBond(5, 6).hasDirection());

        // F and the shared bond sit on opposite sides of atom 3
        if(fluorine.hasDirection())
            assertEquals(towards(shared, 3).inverse(), towards(fluorine, 3));
    }


    private static BondStereo towards(Bond bond, int atom)
    {
        return bond.getAtom2() == atom ? bond.getStereo() : bond.getStereo().inverse();
    }


    @Test
    public void molfile() throws Exception
    {
        Molecule ethanol = MoleculeCreator.readMolfile(ETHANOL_MOLFILE);

        assertEquals(3, ethanol.getAtomCount());
        assertEquals(3, ethanol.getAtom(0).getHydrogens());
        assertEquals(1, ethanol.getAtom(2).getHydrogens());
    }


    @Test
    public void atomContainerFollowsMoleculeOrder()
    {
        Molecule molecule = Molecule.builder().atom(5, "O", 1).atom(2, "C", 3).bond(2, 5, BondOrder.SINGLE).build();
        IAtomContainer container = MoleculeCreator.toAtomContainer(molecule);

        assertEquals(2, container.getAtomCount());
        assertEquals("O", container.getAtom(0).getSymbol());
        assertEquals(Integer.valueOf(3), container.getAtom(1).getImplicitHydrogenCount());
        assertEquals(1, container.getBondCount());
    }
}
