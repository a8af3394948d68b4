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
package cz.iocb.cansmi.molecule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;



/**
 * Chirality descriptor of an atom.
 *
 * A tetrahedral descriptor is either anticlockwise ("@") or clockwise ("@@"). The extended kinds carry a class number
 * written after their two letter tag ("@AL1", "@SP3", "@TB12", "@OH25").
 *
 * The descriptor may remember the neighbour order it was written against. The identifier of the chiral atom itself
 * stands for its implicit hydrogen in that order.
 */
public final class Chirality
{
    public static enum Kind
    {
        TETRAHEDRAL("TH", 2), ALLENAL("AL", 2), SQUARE_PLANAR("SP", 3), TRIGONAL_BIPYRAMIDAL("TB", 20),
        OCTAHEDRAL("OH", 30);

        private final String tag;
        private final int maxConfiguration;

        private Kind(String tag, int maxConfiguration)
        {
            this.tag = tag;
            this.maxConfiguration = maxConfiguration;
        }

        public String getTag()
        {
            return tag;
        }

        public int getMaxConfiguration()
        {
            return maxConfiguration;
        }
    }


    private static final int ANTICLOCKWISE = 1;
    private static final int CLOCKWISE = 2;

    private final Kind kind;
    private final int configuration;
    private final List<Integer> neighbourOrder;


    private Chirality(Kind kind, int configuration, List<Integer> neighbourOrder)
    {
        if(kind == null)
            throw new IllegalArgumentException("chirality kind is required");

        if(configuration < 1 || configuration > kind.getMaxConfiguration())
            throw new IllegalArgumentException("invalid @" + kind.getTag() + " class: " + configuration);

        this.kind = kind;
        this.configuration = configuration;

        if(neighbourOrder == null)
            this.neighbourOrder = Collections.emptyList();
        else
            this.neighbourOrder = Collections.unmodifiableList(new ArrayList<Integer>(neighbourOrder));
    }


    public static Chirality anticlockwise()
    {
        return new Chirality(Kind.TETRAHEDRAL, ANTICLOCKWISE, null);
    }


    public static Chirality clockwise()
    {
        return new Chirality(Kind.TETRAHEDRAL, CLOCKWISE, null);
    }


    public static Chirality of(Kind kind, int configuration)
    {
        return new Chirality(kind, configuration, null);
    }


    /**
     * Parses a chirality token as it appears inside a bracket atom, e.g. "@", "@@", "@TH2" or "@OH14".
     */
    public static Chirality parse(String token)
    {
        if(token == null || !token.startsWith("@"))
            throw new IllegalArgumentException("not a chirality token: " + token);

        if(token.equals("@"))
            return anticlockwise();

        if(token.equals("@@"))
            return clockwise();

        if(token.length() < 4)
            throw new IllegalArgumentException("not a chirality token: " + token);

        String tag = token.substring(1, 3);

        for(Kind kind : Kind.values())
        {
            if(kind.getTag().equals(tag))
            {
                try
                {
                    return new Chirality(kind, Integer.parseInt(token.substring(3)), null);
                }
                catch(NumberFormatException e)
                {
                    throw new IllegalArgumentException("not a chirality token: " + token, e);
                }
            }
        }

        throw new IllegalArgumentException("unknown chirality kind: " + token);
    }


    public Kind getKind()
    {
        return kind;
    }


    public int getConfiguration()
    {
        return configuration;
    }


    public boolean isTetrahedral()
    {
        return kind == Kind.TETRAHEDRAL;
    }


    public boolean isClockwise()
    {
        return kind == Kind.TETRAHEDRAL && configuration == CLOCKWISE;
    }


    public List<Integer> getNeighbourOrder()
    {
        return neighbourOrder;
    }


    public boolean hasNeighbourOrder()
    {
        return !neighbourOrder.isEmpty();
    }


    public Chirality withNeighbourOrder(List<Integer> order)
    {
        return new Chirality(kind, configuration, order);
    }


    /**
     * Returns the tetrahedral descriptor of the opposite handedness written against the same neighbour order.
     */
    public Chirality inverse()
    {
        if(kind != Kind.TETRAHEDRAL)
            throw new IllegalStateException("only tetrahedral chirality can be inverted");

        return new Chirality(kind, configuration == CLOCKWISE ? ANTICLOCKWISE : CLOCKWISE, neighbourOrder);
    }


    public String toSmiles()
    {
        if(kind == Kind.TETRAHEDRAL)
            return configuration == CLOCKWISE ? "@@" : "@";

        return "@" + kind.getTag() + configuration;
    }


    @Override
    public boolean equals(Object obj)
    {
        if(this == obj)
            return true;

        if(!(obj instanceof Chirality))
            return false;

        Chirality other = (Chirality) obj;

        return kind == other.kind && configuration == other.configuration
                && neighbourOrder.equals(other.neighbourOrder);
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(kind, configuration, neighbourOrder);
    }


    @Override
    public String toString()
    {
        return neighbourOrder.isEmpty() ? toSmiles() : toSmiles() + neighbourOrder;
    }
}
