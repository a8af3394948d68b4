/*
 * Copyright (C) 2015-2026 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.cansmi.rings;

import java.util.ArrayList;
import java.util.List;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.shared.MoleculeCreator;



/**
 * Ring perception based on the smallest set of smallest rings as computed by CDK.
 */
public class SssrRingPerception implements RingPerception
{
    @Override
    public RingInfo perceive(Molecule molecule)
    {
        if(molecule.getBondCount() < 3)
            return new RingSet(new ArrayList<List<Integer>>());

        IAtomContainer container = MoleculeCreator.toAtomContainer(molecule);
        int[][] paths = Cycles.sssr(container).paths();

        List<List<Integer>> rings = new ArrayList<List<Integer>>(paths.length);

        for(int[] path : paths)
        {
            // paths are closed walks, the first vertex is repeated at the end
            List<Integer> ring = new ArrayList<Integer>(path.length - 1);

            for(int i = 0; i < path.length - 1; i++)
                ring.add(molecule.getAtoms().get(path[i]).getId());

            rings.add(ring);
        }

        return new RingSet(rings);
    }
}
