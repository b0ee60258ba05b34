package works.quarry.decoder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.MethodSource;
import works.quarry.AbstractPipelineTest;
import works.quarry.exceptions.DecodeException;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.quarry.decoder.Utf8DecoderTest.codePoints;
import static works.quarry.decoder.Utf8DecoderTest.drain;

@ParameterizedClass
@MethodSource("fillerSuppliers")
class AsciiDecoderTest extends AbstractPipelineTest {

	Decoder decoderFor(byte... bytes) {
		return Decoder.create(Encoding.ASCII, fillerFor(bytes));
	}

	@Test
	void everySevenBitByte() {
		byte[] bytes = new byte[0x80];
		for (int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte) i;
		}
		try (Decoder decoder = decoderFor(bytes)) {
			assertEquals(Encoding.ASCII, decoder.encoding());
			assertEquals(codePoints(new String(bytes, US_ASCII)), drain(decoder));
		}
	}

	@Test
	void highBitByte_faultsAtItsOffset() {
		try (Decoder decoder = decoderFor((byte) '{', (byte) 0xC3, (byte) 0xA9)) {
			assertEquals('{', decoder.next());
			DecodeException e = assertThrows(DecodeException.class, decoder::next);
			assertEquals(1, e.byteOffset());
		}
	}

	@Test
	void loneHighByte_faultsAtOffsetZero() {
		try (Decoder decoder = decoderFor((byte) 0x80)) {
			DecodeException e = assertThrows(DecodeException.class, decoder::next);
			assertEquals(0, e.byteOffset());
			assertEquals(0, e.coordinate().offset());
		}
	}
}
