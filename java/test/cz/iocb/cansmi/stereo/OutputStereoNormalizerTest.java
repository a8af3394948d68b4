package cz.iocb.cansmi.stereo;

import static org.junit.Assert.assertEquals;
import org.junit.Test;



public class OutputStereoNormalizerTest
{
    @Test
    public void smallerVariantIsChosen()
    {
        assertEquals("F/C=C/F", OutputStereoNormalizer.normalize("F\\C=C\\F"));
        assertEquals("F/C=C/F", OutputStereoNormalizer.normalize("F/C=C/F"));
        assertEquals("F/C=C\\F", OutputStereoNormalizer.normalize("F\\C=C/F"));
    }


    @Test
    public void stringsWithoutMarkersAreUnchanged()
    {
        assertEquals("C1=C=CC1", OutputStereoNormalizer.normalize("C1=C=CC1"));
        assertEquals("", OutputStereoNormalizer.normalize(""));
    }


    @Test
    public void rotatedRingDoubleBondIsRewritten()
    {
        assertEquals("C/C1=CC=C1", OutputStereoNormalizer.normalize("C/C1=C=CC1"));
    }


    @Test
    public void flip()
    {
        assertEquals("C\\C=C/C", OutputStereoNormalizer.flip("C/C=C\\C"));
    }
}
