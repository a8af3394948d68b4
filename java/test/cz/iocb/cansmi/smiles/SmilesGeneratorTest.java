package cz.iocb.cansmi.smiles;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.shared.MoleculeCreator;



public class SmilesGeneratorTest
{
    private final SmilesGenerator generator = new SmilesGenerator();


    private String canonical(String smiles) throws CDKException
    {
        return generator.generate(MoleculeCreator.readSmiles(smiles));
    }


    @Test
    public void emptyMolecule()
    {
        assertEquals("", generator.generate(Molecule.empty()));
    }


    @Test
    public void simpleMolecules() throws Exception
    {
        assertEquals("C", canonical("[CH4]"));
        assertEquals("C1CCCCC1", canonical("C1CCCCC1"));
        assertEquals("CC(C)C", canonical("C(C)(C)C"));
        assertEquals("[N+](C)(C)(C)C", canonical("C[N+](C)(C)C"));
        assertEquals("[13CH4]", canonical("[13CH4]"));
    }


    @Test
    public void heteroatomsStartTheString() throws Exception
    {
        assertEquals("OCC", canonical("CCO"));
        assertEquals("OCC", canonical("C(O)C"));
        assertEquals("O=C(O)C", canonical("CC(=O)O"));
        assertEquals("O=C(O)C", canonical("OC(C)=O"));
    }


    @Test
    public void aromaticRings() throws Exception
    {
        assertEquals("c1ccccc1", canonical("C1=CC=CC=C1"));
        assertEquals("c1ccccc1", canonical("c1ccccc1"));
        assertEquals("n1ccccc1", canonical("c1ccncc1"));
        assertEquals("[nH]1cccc1", canonical("c1cc[nH]c1"));
        assertEquals("Cc1ccccc1", canonical("c1ccccc1C"));
        assertEquals("c1ccc(cc1)-c2ccccc2", canonical("c1ccccc1-c1ccccc1"));
    }


    @Test
    public void naphthaleneDoesNotDependOnInputOrder() throws Exception
    {
        String first = canonical("c1ccc2ccccc2c1");
        String second = canonical("c2c1ccccc1ccc2");

        assertEquals("c1ccc2ccccc2c1", first);
        assertEquals(first, second);
    }


    @Test
    public void renumberedMoleculesGiveTheSameString() throws Exception
    {
        assertEquals(canonical("OC(=O)c1ccccc1"), canonical("c1ccc(cc1)C(O)=O"));
        assertEquals(canonical("CC(C)Cc1ccc(cc1)C(C)C(O)=O"), canonical("OC(=O)C(C)c1ccc(CC(C)C)cc1"));

        Molecule ethanol = Molecule.builder().atom(0, "C", 3).atom(1, "C", 2).atom(2, "O", 1)
                .bond(0, 1, BondOrder.SINGLE).bond(1, 2, BondOrder.SINGLE).build();
        Molecule shuffled = Molecule.builder().atom(17, "O", 1).atom(3, "C", 3).atom(8, "C", 2)
                .bond(17, 8, BondOrder.SINGLE).bond(3, 8, BondOrder.SINGLE).build();

        assertEquals(generator.generate(ethanol), generator.generate(shuffled));
    }


    @Test
    public void doubleBondConfiguration() throws Exception
    {
        assertEquals("F/C=C/F", canonical("F/C=C/F"));
        assertEquals("F/C=C/F", canonical("F\\C=C\\F"));
        assertEquals("F/C=C\\F", canonical("F/C=C\\F"));
        assertEquals("F/C=C\\F", canonical("F\\C=C/F"));
        assertEquals("FC=C(C)C", canonical("CC(C)=C/F"));
    }


    @Test
    public void doubleBondNextToCarbonyl() throws Exception
    {
        String fumaricAcid = canonical("OC(=O)/C=C/C(O)=O");
        String maleicAcid = canonical("OC(=O)/C=C\\C(O)=O");

        assertEquals("O=C(O)/C=C/C(=O)O", fumaricAcid);
        assertEquals("O=C(O)/C=C\\C(=O)O", maleicAcid);

        assertEquals("O=C/C=C/C", canonical("O=C/C=C/C"));
        assertEquals("O=C/C=C\\C", canonical("O=C/C=C\\C"));

        assertNotEquals(canonical("OC(=O)/C=C/c1ccccc1"), canonical("OC(=O)/C=C\\c1ccccc1"));
    }


    @Test
    public void conjugatedDoubleBondsKeepBothConfigurations() throws Exception
    {
        String trans = canonical("Cl/C=C/C(/F)=C/Cl");
        String cis = canonical("Cl/C=C\\C(/F)=C/Cl");

        assertEquals(trans, canonical(trans));
        assertEquals(cis, canonical(cis));
        assertNotEquals(trans, cis);
        assertNotEquals(trans, canonical("Cl/C=C/C(/F)=C\\Cl"));
    }


    @Test
    public void tetrahedralCentres() throws Exception
    {
        assertEquals("N[C@@H](O)C", canonical("C[C@H](O)N"));
        assertEquals("N[C@@H](O)C", canonical("N[C@@H](O)C"));
        assertEquals("N[C@H](O)C", canonical("C[C@@H](O)N"));
        assertEquals("OC(C)C", canonical("C[C@H](C)O"));
    }


    @Test
    public void disconnectedComponents() throws Exception
    {
        assertEquals("CC.CC", canonical("CC.CC"));
        assertEquals("[Na+].[Cl-]", canonical("[Na+].[Cl-]"));
        assertEquals(1, canonical("CC.CC").split("\\.").length - 1);
    }


    @Test
    public void moleculeList() throws Exception
    {
        String smiles = generator.generate(Arrays.asList(MoleculeCreator.readSmiles("CCO"), Molecule.empty(),
                MoleculeCreator.readSmiles("[Na+]")));

        assertEquals("OCC.[Na+]", smiles);
    }


    @Test
    public void roundTrip() throws Exception
    {
        for(String input : new String[] { "CCO", "CC(=O)O", "c1ccc2ccccc2c1", "C[C@H](O)N", "F/C=C\\F",
                "c1cc[nH]c1", "c1ccccc1-c1ccccc1", "[Na+].[Cl-]", "C1CC2CCC1C2", "O=C1C=CC(=O)C=C1" })
        {
            String smiles = canonical(input);

            assertEquals(input, smiles, canonical(smiles));
        }
    }


    @Test
    public void cubaneIsWrittenCompletely() throws Exception
    {
        // refinement cannot split the cage, so only the graph is compared, not the string
        for(String cubane : Arrays.asList("C12C3C4C1C5C2C3C45", "C12C3C4C1C5C4C3C25"))
        {
            Molecule molecule = MoleculeCreator.readSmiles(canonical(cubane));

            assertEquals(8, molecule.getAtomCount());
            assertEquals(12, molecule.getBondCount());

            for(int i = 0; i < 8; i++)
                assertEquals(3, molecule.getDegree(i));
        }
    }


    @Test
    public void twoDigitRingClosures() throws Exception
    {
        Molecule.Builder builder = Molecule.builder();

        for(int ring = 0; ring < 10; ring++)
        {
            int first = 3 * ring;

            builder.atom(first, "C", ring == 0 ? 2 : 1).atom(first + 1, "C", 2).atom(first + 2, "C", ring == 9 ? 2 : 1);
            builder.bond(first, first + 1, BondOrder.SINGLE).bond(first + 1, first + 2, BondOrder.SINGLE)
                    .bond(first + 2, first, BondOrder.SINGLE);

            if(ring > 0)
                builder.bond(first - 1, first, BondOrder.SINGLE);
        }

        String smiles = generator.generate(builder.build());

        assertTrue(smiles.contains("%10"));
        assertFalse(smiles.contains("%11"));
        assertEquals(smiles, canonical(smiles));
    }


    @Test
    public void asInputModeFollowsAtomIds()
    {
        SmilesGenerator asInput = new SmilesGenerator(false);

        Molecule ethanol = Molecule.builder().atom(0, "C", 3).atom(1, "C", 2).atom(2, "O", 1)
                .bond(0, 1, BondOrder.SINGLE).bond(1, 2, BondOrder.SINGLE).build();
        Molecule aceticAcid = Molecule.builder().atom(0, "C", 3).atom(1, "C", 0).atom(2, "O", 0).atom(3, "O", 1)
                .bond(0, 1, BondOrder.SINGLE).bond(1, 2, BondOrder.DOUBLE).bond(1, 3, BondOrder.SINGLE).build();

        Molecule.Builder builder = Molecule.builder();

        for(int i = 0; i < 6; i++)
            builder.atom(i, "C", 1);

        for(int i = 0; i < 6; i++)
            builder.bond(i, (i + 1) % 6, i % 2 == 0 ? BondOrder.DOUBLE : BondOrder.SINGLE);

        assertFalse(asInput.isCanonical());
        assertEquals("CCO", asInput.generate(ethanol));
        assertEquals("CC(=O)O", asInput.generate(aceticAcid));
        assertEquals("C1=CC=CC=C1", asInput.generate(builder.build()));
    }
}
