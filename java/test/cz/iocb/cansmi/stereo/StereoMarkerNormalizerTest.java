package cz.iocb.cansmi.stereo;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import org.junit.Test;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.BondStereo;
import cz.iocb.cansmi.molecule.Molecule;



public class StereoMarkerNormalizerTest
{
    private static Molecule difluoroethene(BondStereo first, BondStereo second)
    {
        return Molecule.builder().atom(0, "F", 0).atom(1, "C", 1).atom(2, "C", 1).atom(3, "F", 0)
                .bond(0, 1, BondOrder.SINGLE, first).bond(1, 2, BondOrder.DOUBLE)
                .bond(2, 3, BondOrder.SINGLE, second).build();
    }


    @Test
    public void allDownBecomesAllUp()
    {
        Molecule normalized = StereoMarkerNormalizer.normalize(difluoroethene(BondStereo.DOWN, BondStereo.DOWN));

        assertEquals(BondStereo.UP, normalized.getBond(0, 1).getStereo());
        assertEquals(BondStereo.UP, normalized.getBond(2, 3).getStereo());
    }


    @Test
    public void mixedMarkersAreKept()
    {
        Molecule molecule = difluoroethene(BondStereo.UP, BondStereo.DOWN);

        assertSame(molecule, StereoMarkerNormalizer.normalize(molecule));
    }


    @Test
    public void markersSharedByConjugatedDoubleBondsAreKept()
    {
        Molecule molecule = Molecule.builder().atom(0, "F", 0).atom(1, "C", 1).atom(2, "C", 1).atom(3, "C", 1)
                .atom(4, "C", 1).atom(5, "F", 0).bond(0, 1, BondOrder.SINGLE, BondStereo.DOWN)
                .bond(1, 2, BondOrder.DOUBLE).bond(2, 3, BondOrder.SINGLE, BondStereo.DOWN)
                .bond(3, 4, BondOrder.DOUBLE).bond(4, 5, BondOrder.SINGLE, BondStereo.DOWN).build();

        assertSame(molecule, StereoMarkerNormalizer.normalize(molecule));
    }


    @Test
    public void carbonylDoesNotBlockNormalization()
    {
        // O=C\C=C\C
        Molecule molecule = Molecule.builder().atom(0, "O", 0).atom(1, "C", 1).atom(2, "C", 1).atom(3, "C", 1)
                .atom(4, "C", 3).bond(0, 1, BondOrder.DOUBLE).bond(1, 2, BondOrder.SINGLE, BondStereo.DOWN)
                .bond(2, 3, BondOrder.DOUBLE).bond(3, 4, BondOrder.SINGLE, BondStereo.DOWN).build();

        Molecule normalized = StereoMarkerNormalizer.normalize(molecule);

        assertEquals(BondStereo.UP, normalized.getBond(1, 2).getStereo());
        assertEquals(BondStereo.UP, normalized.getBond(3, 4).getStereo());
    }
}
