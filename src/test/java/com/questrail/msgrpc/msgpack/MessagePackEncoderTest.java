package com.questrail.msgrpc.msgpack;

import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessagePackEncoderTest
 * -----------------------------------------------------------------------------
 * Byte-exact checks that every value is written in its shortest form, with
 * the emphasis on the edges between length classes.
 */
final class MessagePackEncoderTest
{
    private static String hex(MessagePackEncoder enc) {
        return HexFormat.of().formatHex(enc.toByteArray());
    }

    private static String packInt(long v) {
        return hex(new MessagePackEncoder().packInt(v));
    }

    @Test
    void nonNegativeIntegersUseUnsignedForms()
    {
        assertEquals("00", packInt(0));
        assertEquals("7f", packInt(127));
        assertEquals("cc80", packInt(128));
        assertEquals("ccff", packInt(255));
        assertEquals("cd0100", packInt(256));
        assertEquals("cdffff", packInt(65535));
        assertEquals("ce00010000", packInt(65536));
        assertEquals("ceffffffff", packInt(4294967295L));
        assertEquals("cf0000000100000000", packInt(4294967296L));
        assertEquals("cf7fffffffffffffff", packInt(Long.MAX_VALUE));
    }

    @Test
    void negativeIntegersUseSignedForms()
    {
        assertEquals("ff", packInt(-1));
        assertEquals("e0", packInt(-32));
        assertEquals("d0df", packInt(-33));
        assertEquals("d080", packInt(-128));
        assertEquals("d1ff7f", packInt(-129));
        assertEquals("d18000", packInt(-32768));
        assertEquals("d2ffff7fff", packInt(-32769));
        assertEquals("d280000000", packInt(Integer.MIN_VALUE));
        assertEquals("d3ffffffff7fffffff", packInt(Integer.MIN_VALUE - 1L));
        assertEquals("d38000000000000000", packInt(Long.MIN_VALUE));
    }

    @Test
    void packUintTreatsArgumentAsUnsigned()
    {
        assertEquals("cfffffffffffffffff", hex(new MessagePackEncoder().packUint(-1L)));
        assertEquals("cc80", hex(new MessagePackEncoder().packUint(128)));
    }

    @Test
    void scalarsAndFloats()
    {
        assertEquals("c0", hex(new MessagePackEncoder().packNil()));
        assertEquals("c3c2", hex(new MessagePackEncoder().packBool(true).packBool(false)));
        assertEquals("cb3ff8000000000000", hex(new MessagePackEncoder().packFloat(1.5)));
        assertEquals("ca3fc00000", hex(new MessagePackEncoder().packFloat32(1.5f)));
    }

    @Test
    void stringLengthClasses()
    {
        assertEquals("a0", hex(new MessagePackEncoder().packString("")));
        assertTrue(hex(new MessagePackEncoder().packString("a".repeat(31))).startsWith("bf61"));
        assertTrue(hex(new MessagePackEncoder().packString("a".repeat(32))).startsWith("d92061"));
        assertTrue(hex(new MessagePackEncoder().packString("a".repeat(255))).startsWith("d9ff61"));
        assertTrue(hex(new MessagePackEncoder().packString("a".repeat(256))).startsWith("da010061"));
        assertTrue(hex(new MessagePackEncoder().packString("a".repeat(65536))).startsWith("db0001000061"));
    }

    @Test
    void stringLengthCountsUtf8Bytes()
    {
        // U+00E9 is two bytes in UTF-8
        assertEquals("a2c3a9", hex(new MessagePackEncoder().packString("é")));
    }

    @Test
    void binaryLengthClasses()
    {
        assertEquals("c400", hex(new MessagePackEncoder().packBinary(new byte[0])));
        assertTrue(hex(new MessagePackEncoder().packBinary(new byte[255])).startsWith("c4ff"));
        assertTrue(hex(new MessagePackEncoder().packBinary(new byte[256])).startsWith("c50100"));
        assertTrue(hex(new MessagePackEncoder().packBinary(new byte[65536])).startsWith("c600010000"));
    }

    @Test
    void collectionHeaderClasses() throws Exception
    {
        assertEquals("90", hex(new MessagePackEncoder().packArrayHeader(0)));
        assertEquals("9f", hex(new MessagePackEncoder().packArrayHeader(15)));
        assertEquals("dc0010", hex(new MessagePackEncoder().packArrayHeader(16)));
        assertEquals("dcffff", hex(new MessagePackEncoder().packArrayHeader(65535)));
        assertEquals("dd00010000", hex(new MessagePackEncoder().packArrayHeader(65536)));

        assertEquals("80", hex(new MessagePackEncoder().packMapHeader(0)));
        assertEquals("8f", hex(new MessagePackEncoder().packMapHeader(15)));
        assertEquals("de0010", hex(new MessagePackEncoder().packMapHeader(16)));
        assertEquals("df00010000", hex(new MessagePackEncoder().packMapHeader(65536)));
    }

    @Test
    void invalidCollectionLengthsAreRejected()
    {
        assertThrows(MessagePackException.class, () -> new MessagePackEncoder().packArrayHeader(-1));
        assertThrows(MessagePackException.class, () -> new MessagePackEncoder().packMapHeader(1L << 32));
    }

    @Test
    void extensionUsesFixextOnlyForExactLengths() throws Exception
    {
        assertEquals("d40501", hex(new MessagePackEncoder().packExtension(5, new byte[] { 1 })));
        assertEquals("d5050102", hex(new MessagePackEncoder().packExtension(5, new byte[] { 1, 2 })));
        assertEquals("c70305010203", hex(new MessagePackEncoder().packExtension(5, new byte[] { 1, 2, 3 })));
        assertTrue(hex(new MessagePackEncoder().packExtension(-1, new byte[4])).startsWith("d6ff"));
        assertTrue(hex(new MessagePackEncoder().packExtension(1, new byte[8])).startsWith("d701"));
        assertTrue(hex(new MessagePackEncoder().packExtension(1, new byte[16])).startsWith("d801"));
        assertTrue(hex(new MessagePackEncoder().packExtension(1, new byte[17])).startsWith("c71101"));
        assertEquals("c70001", hex(new MessagePackEncoder().packExtension(1, new byte[0])));
        assertTrue(hex(new MessagePackEncoder().packExtension(1, new byte[256])).startsWith("c8010001"));
        assertTrue(hex(new MessagePackEncoder().packExtension(1, new byte[65536])).startsWith("c90001000001"));
    }

    @Test
    void extensionTypeMustFitInAByte()
    {
        assertThrows(MessagePackException.class, () -> new MessagePackEncoder().packExtension(128, new byte[1]));
        assertThrows(MessagePackException.class, () -> new MessagePackEncoder().packExtension(-129, new byte[1]));
    }

    @Test
    void resetDiscardsOutput() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packArrayHeader(2).packInt(1).packInt(2);
        assertEquals(3, enc.size());
        enc.reset();
        assertEquals(0, enc.size());
        assertThrows(IllegalStateException.class, enc::toRawValue);
    }
}
