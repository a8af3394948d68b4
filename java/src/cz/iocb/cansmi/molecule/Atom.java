package cz.iocb.cansmi.molecule;

import java.util.Objects;



/**
 * Immutable atom record. Passes that need a modified atom create a copy through one of the {@code with} methods.
 */
public final class Atom
{
    private final int id;
    private final String symbol;
    private final int atomicNumber;
    private final int charge;
    private final int hydrogens;
    private final int isotope;
    private final boolean aromatic;
    private final Chirality chirality;
    private final boolean bracket;
    private final int atomClass;


    public Atom(int id, String symbol, int atomicNumber, int charge, int hydrogens, int isotope, boolean aromatic,
            Chirality chirality, boolean bracket, int atomClass)
    {
        if(symbol == null || symbol.isEmpty())
            throw new IllegalArgumentException("atom " + id + " has no element symbol");

        if(hydrogens < 0)
            throw new IllegalArgumentException("atom " + id + " has a negative hydrogen count");

        if(isotope < 0)
            throw new IllegalArgumentException("atom " + id + " has a negative isotope");

        if(atomClass < 0)
            throw new IllegalArgumentException("atom " + id + " has a negative atom class");

        this.id = id;
        this.symbol = symbol;
        this.atomicNumber = atomicNumber;
        this.charge = charge;
        this.hydrogens = hydrogens;
        this.isotope = isotope;
        this.aromatic = aromatic;
        this.chirality = chirality;
        this.bracket = bracket;
        this.atomClass = atomClass;
    }


    public Atom(int id, String symbol, int atomicNumber, int hydrogens)
    {
        this(id, symbol, atomicNumber, 0, hydrogens, 0, false, null, false, 0);
    }


    public int getId()
    {
        return id;
    }


    public String getSymbol()
    {
        return symbol;
    }


    public int getAtomicNumber()
    {
        return atomicNumber;
    }


    public int getCharge()
    {
        return charge;
    }


    public int getHydrogens()
    {
        return hydrogens;
    }


    /**
     * Returns the mass number, or 0 when no isotope is given.
     */
    public int getIsotope()
    {
        return isotope;
    }


    public boolean isAromatic()
    {
        return aromatic;
    }


    public Chirality getChirality()
    {
        return chirality;
    }


    public boolean hasChirality()
    {
        return chirality != null;
    }


    public boolean isBracket()
    {
        return bracket;
    }


    public int getAtomClass()
    {
        return atomClass;
    }


    public Atom withCharge(int charge)
    {
        return new Atom(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket, atomClass);
    }


    public Atom withIsotope(int isotope)
    {
        return new Atom(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket, atomClass);
    }


    public Atom withAromatic(boolean aromatic)
    {
        return new Atom(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket, atomClass);
    }


    public Atom withChirality(Chirality chirality)
    {
        return new Atom(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket, atomClass);
    }


    public Atom withBracket(boolean bracket)
    {
        return new Atom(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket, atomClass);
    }


    public Atom withAtomClass(int atomClass)
    {
        return new Atom(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket, atomClass);
    }


    @Override
    public boolean equals(Object obj)
    {
        if(this == obj)
            return true;

        if(!(obj instanceof Atom))
            return false;

        Atom other = (Atom) obj;

        return id == other.id && symbol.equals(other.symbol) && atomicNumber == other.atomicNumber
                && charge == other.charge && hydrogens == other.hydrogens && isotope == other.isotope
                && aromatic == other.aromatic && Objects.equals(chirality, other.chirality)
                && bracket == other.bracket && atomClass == other.atomClass;
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(id, symbol, atomicNumber, charge, hydrogens, isotope, aromatic, chirality, bracket,
                atomClass);
    }


    @Override
    public String toString()
    {
        return "Atom[" + id + ":" + (aromatic ? symbol.toLowerCase() : symbol) + "]";
    }
}
