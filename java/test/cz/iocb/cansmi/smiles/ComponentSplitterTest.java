package cz.iocb.cansmi.smiles;

import static org.junit.Assert.assertEquals;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.Molecule;



public class ComponentSplitterTest
{
    @Test
    public void componentsFollowAtomOrder()
    {
        Molecule molecule = Molecule.builder().atom(4, "C", 3).atom(0, "O", 1).atom(1, "C", 3).atom(2, "Cl", 0)
                .atom(3, "C", 2).bond(1, 3, BondOrder.SINGLE).bond(3, 0, BondOrder.SINGLE).build();

        List<List<Integer>> components = ComponentSplitter.split(molecule);

        assertEquals(3, components.size());
        assertEquals(Arrays.asList(4), components.get(0));
        assertEquals(Arrays.asList(0, 3, 1), components.get(1));
        assertEquals(Arrays.asList(2), components.get(2));
    }


    @Test
    public void emptyMoleculeHasNoComponents()
    {
        assertEquals(0, ComponentSplitter.split(Molecule.empty()).size());
    }
}
