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
package cz.iocb.cansmi.stereo;

import java.util.regex.Pattern;



/**
 * Chooses one of the two equivalent ways of writing the double bond configurations of a SMILES string.
 */
public class OutputStereoNormalizer
{
    private static final Pattern rotatedRingDoubleBond = Pattern.compile("([1-9])=C=CC\\1");


    /**
     * Returns the lexicographically smaller of the string and its variant with every "/" and "\" swapped. Strings
     * without directional bonds are returned unchanged.
     */
    public static String normalize(String smiles)
    {
        if(smiles.indexOf('/') < 0 && smiles.indexOf('\\') < 0)
            return smiles;

        String flipped = flip(smiles);
        String normalized = flipped.compareTo(smiles) < 0 ? flipped : smiles;

        return rotatedRingDoubleBond.matcher(normalized).replaceAll("$1=CC=C$1");
    }


    static String flip(String smiles)
    {
        char[] chars = smiles.toCharArray();

        for(int i = 0; i < chars.length; i++)
        {
            if(chars[i] == '/')
                chars[i] = '\\';
            else if(chars[i] == '\\')
                chars[i] = '/';
        }

        return new String(chars);
    }
}
