package com.questrail.pvl.codec.quote;

import com.questrail.pvl.codec.EncodingRejectedException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GrammarTextQuoterTest
{
    private final TextQuoter pvl = GrammarTextQuoter.pvl();
    private final TextQuoter odl = GrammarTextQuoter.odl();

    @Test
    void plainSymbolsStayBare()
    {
        assertFalse(pvl.needsQuotes("PHOBOS"));
        assertFalse(pvl.needsQuotes("MARS_RECONNAISSANCE_ORBITER"));
        assertFalse(pvl.needsQuotes("N/A"));
        assertFalse(odl.needsQuotes("IMAGE"));
    }

    @Test
    void reservedWordsNeedQuotes_caseInsensitively()
    {
        assertTrue(pvl.needsQuotes("END"));
        assertTrue(pvl.needsQuotes("end_group"));
        assertTrue(pvl.needsQuotes("Null"));
        assertTrue(pvl.needsQuotes("true"));
    }

    @Test
    void emptyWhitespaceAndReservedCharactersNeedQuotes()
    {
        assertTrue(pvl.needsQuotes(""));
        assertTrue(pvl.needsQuotes("two words"));
        assertTrue(pvl.needsQuotes("tab\there"));
        assertTrue(pvl.needsQuotes("a=b"));
        assertTrue(pvl.needsQuotes("x{y}"));
        assertTrue(pvl.needsQuotes("note/*comment*/"));
    }

    @Test
    void numberLikeTextNeedsQuotes()
    {
        assertTrue(pvl.needsQuotes("123"));
        assertTrue(pvl.needsQuotes("-5"));
        assertTrue(pvl.needsQuotes(".5"));
        assertTrue(pvl.needsQuotes("2001-01-01T12:00:00"));
    }

    @Test
    void pvlPrefersDoubleQuotes_fallsBackToSingle()
    {
        assertEquals("\"two words\"", pvl.quote("two words"));
        assertEquals("'say \"hi\"'", pvl.quote("say \"hi\""));
    }

    @Test
    void pvlRejectsTextWithBothQuoteCharacters()
    {
        EncodingRejectedException e = assertThrows(EncodingRejectedException.class,
                () -> pvl.quote("it's \"both\""));
        assertEquals("it's \"both\"", e.text());
    }

    @Test
    void odlRejectsDoubleQuotesAndNonAscii()
    {
        assertEquals("\"it's fine\"", odl.quote("it's fine"));
        assertThrows(EncodingRejectedException.class, () -> odl.quote("say \"hi\""));

        assertTrue(odl.needsQuotes("Gale_Kräter"));
        assertFalse(pvl.needsQuotes("Gale_Kräter"));
        assertThrows(EncodingRejectedException.class, () -> odl.quote("Gale_Kräter"));
    }
}
