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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import org.certvet.testing.SctBytes;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SignedCertificateTimestampTest {
    @Test
    public void decode() throws Exception {
        byte[] in = new byte[] {
            0x00,                            // version
            1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1, // log id
            1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,
            0x00, 0x00, 0x01, (byte) 0x8c,   // timestamp
            (byte) 0xc2, 0x51, (byte) 0xf4, 0x00,
            0x00, 0x00,                      // extensions length
            0x04, 0x03,                      // hash & signature algorithm
            0x00, 0x04,                      // signature length
            0x12, 0x34, 0x56, 0x78           // signature
        };

        SignedCertificateTimestamp sct =
                SignedCertificateTimestamp.decode(in, SignedCertificateTimestamp.Origin.EMBEDDED);

        assertEquals(Instant.ofEpochMilli(0x18cc251f400L), sct.getTimestamp());
        assertArrayEquals(SctBytes.logId(1), sct.getLogId());
        assertEquals(SignedCertificateTimestamp.Origin.EMBEDDED, sct.getOrigin());
    }

    @Test
    public void decode_minimumLength() throws Exception {
        byte[] in = new byte[45];
        SignedCertificateTimestamp sct = SignedCertificateTimestamp.decode(
                in, SignedCertificateTimestamp.Origin.TLS_EXTENSION);
        assertEquals(Instant.EPOCH, sct.getTimestamp());

        try {
            SignedCertificateTimestamp.decode(
                    new byte[44], SignedCertificateTimestamp.Origin.TLS_EXTENSION);
            fail();
        } catch (SerializationException expected) {
            assertTrue(expected.getMessage().contains("too short"));
        }
    }

    @Test
    public void decode_rejectsUnknownVersion() {
        byte[] in = SctBytes.sct(SctBytes.logId(2), 1000L);
        in[0] = 1;
        try {
            SignedCertificateTimestamp.decode(in, SignedCertificateTimestamp.Origin.EMBEDDED);
            fail();
        } catch (SerializationException expected) {
            assertTrue(expected.getMessage().contains("version"));
        }
    }

    @Test
    public void logIdIsCopied() throws Exception {
        SignedCertificateTimestamp sct = SignedCertificateTimestamp.decode(
                SctBytes.sct(SctBytes.logId(3), 5L), SignedCertificateTimestamp.Origin.EMBEDDED);
        sct.getLogId()[0] = 0;
        assertArrayEquals(SctBytes.logId(3), sct.getLogId());
    }
}
