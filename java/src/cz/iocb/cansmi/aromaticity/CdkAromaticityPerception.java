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
package cz.iocb.cansmi.aromaticity;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.cansmi.molecule.Atom;
import cz.iocb.cansmi.molecule.Bond;
import cz.iocb.cansmi.molecule.BondOrder;
import cz.iocb.cansmi.molecule.Molecule;
import cz.iocb.cansmi.shared.MoleculeCreator;



/**
 * Aromaticity perception by the CDK Daylight model. A molecule which already contains aromatic bonds is returned as
 * it is, because its kekulé structure is not known.
 */
public class CdkAromaticityPerception implements AromaticityPerception
{
    private static final Logger LOGGER = LogManager.getLogger(CdkAromaticityPerception.class);


    @Override
    public Molecule perceive(Molecule molecule)
    {
        for(Bond bond : molecule.getBonds())
        {
            if(bond.getOrder() == BondOrder.AROMATIC)
            {
                LOGGER.debug("aromatic bonds present, aromaticity perception skipped");
                return molecule;
            }
        }

        IAtomContainer container = MoleculeCreator.toAtomContainer(molecule);

        try
        {
            MoleculeCreator.configureAromaticity(container);
        }
        catch(CDKException e)
        {
            throw new IllegalStateException("aromaticity perception failed", e);
        }

        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());

        for(int i = 0; i < molecule.getAtomCount(); i++)
            atoms.add(molecule.getAtoms().get(i).withAromatic(container.getAtom(i).isAromatic()));

        List<Bond> bonds = new ArrayList<Bond>(molecule.getBondCount());

        for(int i = 0; i < molecule.getBondCount(); i++)
        {
            Bond bond = molecule.getBonds().get(i);

            if(container.getBond(i).isAromatic())
                bonds.add(bond.withOrder(BondOrder.AROMATIC));
            else
                bonds.add(bond);
        }

        return new Molecule(atoms, bonds);
    }
}
