package com.questrail.pvl.sink.netty;

import com.questrail.pvl.codec.LabelEncoders;
import com.questrail.pvl.model.LabelMapping;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class ByteBufLabelSinkTest
{
    @Test
    void appendsAtWriterIndex_withoutReleasingBuffer()
    {
        ByteBuf buf = Unpooled.buffer();
        try {
            buf.writeBytes("PDS_VERSION_ID = PDS3\n".getBytes(StandardCharsets.US_ASCII));

            LabelMapping label = LabelMapping.builder()
                    .put("RECORD_TYPE", "FIXED_LENGTH")
                    .put("RECORD_BYTES", 512)
                    .build();
            LabelEncoders.pds3().encode(label, new ByteBufLabelSink(buf));

            assertEquals(1, buf.refCnt());
            assertEquals("PDS_VERSION_ID = PDS3\n"
                            + "RECORD_TYPE  = FIXED_LENGTH\n"
                            + "RECORD_BYTES = 512\n"
                            + "END",
                    buf.toString(StandardCharsets.UTF_8));
        }
        finally {
            buf.release();
        }
    }

    @Test
    void stringWritesAreUtf8()
    {
        ByteBuf buf = Unpooled.buffer();
        try {
            new ByteBufLabelSink(buf).write("Kräter");
            assertEquals(7, buf.readableBytes());
        }
        finally {
            buf.release();
        }
    }
}
