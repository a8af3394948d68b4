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
package cz.iocb.cansmi.convert;

import java.io.IOException;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.cansmi.shared.MoleculeCreator;
import cz.iocb.cansmi.smiles.SmilesGenerator;



public class ConvertMolecule
{
    private static final SmilesGenerator generator = new SmilesGenerator();


    public static String smilesToCanonicalSmiles(String smiles) throws CDKException
    {
        return generator.generate(MoleculeCreator.readSmiles(smiles));
    }


    public static String molfileToCanonicalSmiles(String molfile) throws CDKException, IOException
    {
        return generator.generate(MoleculeCreator.readMolfile(molfile));
    }
}
