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
package cz.iocb.cansmi.smiles;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.cansmi.aromaticity.AromaticityPerception;
import cz.iocb.cansmi.aromaticity.CdkAromaticityPerception;
import cz.iocb.cansmi.label.CanonicalLabeler;
import cz.iocb.cansmi.label.CanonicalLabels;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.rings.RingInfo;
import cz.iocb.cansmi.rings.RingPerception;
import cz.iocb.cansmi.rings.SssrRingPerception;
import cz.iocb.cansmi.stereo.OutputStereoNormalizer;
import cz.iocb.cansmi.stereo.StereoMarkerNormalizer;
import cz.iocb.cansmi.stereo.StereoPruner;
import cz.iocb.cansmi.stereo.StereoValidator;
import cz.iocb.cansmi.stereo.SymmetryStereoValidator;



/**
 * Encodes molecules as SMILES strings.
 *
 * <p>
 * In the canonical mode, the molecule is first normalised (aromaticity, stereo validation, bracket minimisation and
 * marker normalisation), each connected component is labelled, traversed and written, and the component strings are
 * joined by ".". Isomorphic inputs produce identical strings as long as label refinement separates the atoms which
 * the traversal has to tell apart; in highly symmetric cage graphs, such as cubane, the atom id tie-breaks can leak into
 * the output. In the as-input mode the atom ids stand for the labels, so the output follows the input numbering.
 *
 * <p>
 * Instances are immutable and can be shared by threads as long as the injected collaborators can.
 */
public class SmilesGenerator
{
    private static final Logger LOGGER = LogManager.getLogger(SmilesGenerator.class);

    private final boolean canonical;
    private final RingPerception ringPerception;
    private final AromaticityPerception aromaticityPerception;
    private final StereoValidator stereoValidator;
    private final CanonicalLabeler labeler = new CanonicalLabeler();
    private final TraversalPlanner planner = new TraversalPlanner();
    private final SmilesSerializer serializer = new SmilesSerializer();


    public SmilesGenerator()
    {
        this(true);
    }


    public SmilesGenerator(boolean canonical)
    {
        this(canonical, new SssrRingPerception());
    }


    private SmilesGenerator(boolean canonical, RingPerception ringPerception)
    {
        this(canonical, ringPerception, new CdkAromaticityPerception(), new SymmetryStereoValidator(ringPerception));
    }


    public SmilesGenerator(boolean canonical, RingPerception ringPerception,
            AromaticityPerception aromaticityPerception, StereoValidator stereoValidator)
    {
        if(ringPerception == null || aromaticityPerception == null || stereoValidator == null)
            throw new IllegalArgumentException("missing collaborator");

        this.canonical = canonical;
        this.ringPerception = ringPerception;
        this.aromaticityPerception = aromaticityPerception;
        this.stereoValidator = stereoValidator;
    }


    public boolean isCanonical()
    {
        return canonical;
    }


    public String generate(Molecule molecule)
    {
        if(molecule.isEmpty())
            return "";

        Molecule prepared = prepare(molecule);
        RingInfo rings = ringPerception.perceive(prepared);
        prepared = StereoPruner.prune(prepared, rings);

        if(canonical)
        {
            prepared = BracketMinimizer.minimize(prepared);
            prepared = StereoMarkerNormalizer.normalize(prepared);
        }

        List<List<Integer>> components = ComponentSplitter.split(prepared);
        LOGGER.debug("encoding " + components.size() + " components of " + prepared.getAtomCount() + " atoms");

        StringBuilder builder = new StringBuilder();

        for(List<Integer> atoms : components)
        {
            if(builder.length() > 0)
                builder.append('.');

            builder.append(generateComponent(prepared.subMolecule(atoms), rings));
        }

        return builder.toString();
    }


    /**
     * Encodes the molecules independently and joins their strings by ".". Empty molecules contribute nothing.
     */
    public String generate(List<Molecule> molecules)
    {
        List<String> parts = new ArrayList<String>(molecules.size());

        for(Molecule molecule : molecules)
        {
            String smiles = generate(molecule);

            if(!smiles.isEmpty())
                parts.add(smiles);
        }

        return String.join(".", parts);
    }


    private Molecule prepare(Molecule molecule)
    {
        if(!canonical)
            return molecule;

        Molecule aromatic = aromaticityPerception.perceive(molecule);
        return stereoValidator.validate(aromatic);
    }


    private String generateComponent(Molecule component, RingInfo rings)
    {
        CanonicalLabels labels = canonical ? labeler.label(component, rings) : CanonicalLabeler.identity(component);
        Traversal traversal = planner.plan(component, labels);
        String smiles = serializer.serialize(component, labels, traversal);

        return OutputStereoNormalizer.normalize(smiles);
    }
}
