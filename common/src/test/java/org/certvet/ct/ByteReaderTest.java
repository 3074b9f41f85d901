/*
 * Copyright (C) 2025 The Certvet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.certvet.ct;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ByteReaderTest {
    @Test
    public void readUnsigned() throws Exception {
        ByteReader in = new ByteReader(new byte[] {0x01, 0x02, (byte) 0xff, 0x00, 0x10});
        assertEquals(0x0102L, in.readUnsigned(2));
        assertEquals(0xff0010L, in.readUnsigned(3));
        assertFalse(in.hasRemaining());
        try {
            in.readUnsigned(1);
            fail();
        } catch (SerializationException expected) {
            assertTrue(expected.getMessage().contains("Premature end"));
        }
    }

    @Test
    public void readPrefixed_boundsBody() throws Exception {
        ByteReader in = new ByteReader(new byte[] {0x00, 0x02, 0x0a, 0x0b, 0x0c});
        ByteReader body = in.readPrefixed(2);
        assertEquals(2, body.remaining());
        assertArrayEquals(new byte[] {0x0a, 0x0b}, body.readRemaining());
        assertEquals(1, in.remaining());
        try {
            body.readBytes(1);
            fail();
        } catch (SerializationException expected) {
        }
    }

    @Test
    public void readPrefixed_rejectsLengthBeyondData() {
        try {
            new ByteReader(new byte[] {(byte) 0xff, (byte) 0xff, 0x01}).readPrefixed(2);
            fail();
        } catch (SerializationException expected) {
            assertTrue(expected.getMessage().contains("65535"));
        }
    }

    @Test
    public void readDerOctetString_shortAndLongForm() throws Exception {
        ByteReader shortForm = new ByteReader(new byte[] {0x04, 0x02, 0x01, 0x02});
        assertArrayEquals(new byte[] {0x01, 0x02}, shortForm.readDerOctetString().readRemaining());

        ByteReader longForm = new ByteReader(new byte[] {0x04, (byte) 0x81, 0x01, 0x09});
        assertArrayEquals(new byte[] {0x09}, longForm.readDerOctetString().readRemaining());
    }

    @Test
    public void readDerOctetString_rejectsMalformed() {
        byte[][] inputs = {
            {0x05, 0x00},                                           // NULL, not OCTET STRING
            {0x04, (byte) 0x80, 0x00, 0x00},                        // indefinite length
            {0x04, (byte) 0x85, 0x00, 0x00, 0x00, 0x00, 0x01, 0x00}, // 5 length bytes
            {0x04, (byte) 0x84, (byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff, 0x00},
            {0x04, 0x03, 0x00},
        };
        for (byte[] input : inputs) {
            try {
                new ByteReader(input).readDerOctetString();
                fail("accepted " + input.length + " byte input starting " + input[1]);
            } catch (SerializationException expected) {
            }
        }
    }
}
