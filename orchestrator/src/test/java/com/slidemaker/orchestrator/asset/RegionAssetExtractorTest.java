package com.slidemaker.orchestrator.asset;

import com.slidemaker.orchestrator.input.InputUnit;
import com.slidemaker.orchestrator.model.CoordinateSpace;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionAssetExtractorTest {

    private final RegionAssetExtractor extractor = new RegionAssetExtractor();

    private static InputUnit pngUnit(int width, int height) throws Exception {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(15, 25, 0xFF0000);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return new InputUnit("page-1", 0, out.toByteArray(), "image/png", new CoordinateSpace(width, height));
    }

    @Test
    void extract_regionInsideImage_returnsCropOfThatSize() throws Exception {
        byte[] png = extractor.extract(pngUnit(100, 80), new AssetRequest.Region(10, 20, 30, 40));

        BufferedImage crop = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(crop.getWidth()).isEqualTo(30);
        assertThat(crop.getHeight()).isEqualTo(40);
        assertThat(crop.getRGB(5, 5) & 0xFFFFFF).isEqualTo(0xFF0000);
    }

    @Test
    void extract_regionOverhangingEdge_isClipped() throws Exception {
        byte[] png = extractor.extract(pngUnit(100, 80), new AssetRequest.Region(90, 70, 50, 50));

        BufferedImage crop = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(crop.getWidth()).isEqualTo(10);
        assertThat(crop.getHeight()).isEqualTo(10);
    }

    @Test
    void extract_regionOutsideImage_fails() {
        assertThatThrownBy(() -> extractor.extract(pngUnit(100, 80), new AssetRequest.Region(200, 200, 5, 5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside");
    }
}
