package com.streamfirst.watcher.adapters.http;

import com.streamfirst.watcher.domain.BlockMaterial;
import com.streamfirst.watcher.domain.BlockSignature;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class BlockMaterialCodecTest {

    @Test
    void decodesSignedBlock() {
        String json = """
                {
                  "index": 42,
                  "contents": "AQID",
                  "signature": {"signer": "ab01", "signature": "cd02", "signedAt": 1700000000}
                }
                """;

        BlockMaterial material = BlockMaterialCodec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertThat(material.getIndex()).isEqualTo(42);
        assertThat(material.getContents()).containsExactly(1, 2, 3);
        assertThat(material.getSignature()).contains(
                new BlockSignature("ab01", "cd02", Instant.ofEpochSecond(1700000000)));
    }

    @Test
    void decodesUnsignedBlock() {
        BlockMaterial material = BlockMaterialCodec.decode(
                "{\"index\":0,\"contents\":\"\",\"signature\":null}".getBytes(StandardCharsets.UTF_8));

        assertThat(material.getContents()).isEmpty();
        assertThat(material.getSignature()).isEmpty();
    }

    @Test
    void encodedBlockDecodesToSameMaterial() {
        BlockMaterial material = BlockMaterial.signed(7, new byte[] {9, 8}, BlockSignature.of("ab", "cd"));

        BlockMaterial decoded = BlockMaterialCodec.decode(BlockMaterialCodec.encode(material));

        assertThat(decoded).isEqualTo(material);
        assertThat(decoded.getSignature()).isEqualTo(material.getSignature());
    }

    @Test
    void rejectsMalformedInput() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode("{\"index\":1}".getBytes(StandardCharsets.UTF_8)));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode(
                        "{\"index\":1,\"contents\":\"!!\"}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejectsSignatureThatIsNotAnObject() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode(
                        "{\"index\":1,\"contents\":\"AQ==\",\"signature\":\"cd02\"}".getBytes(StandardCharsets.UTF_8)))
                .withMessageContaining("signature");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode(
                        "{\"index\":1,\"contents\":\"AQ==\",\"signature\":[1]}".getBytes(StandardCharsets.UTF_8)));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlockMaterialCodec.decode(
                        "{\"index\":1,\"contents\":{}}".getBytes(StandardCharsets.UTF_8)));
    }
}
