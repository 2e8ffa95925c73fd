package com.slidemaker.orchestrator.input;

import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.model.CoordinateSpace;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rasterizes every page of a PDF to PNG at a fixed resolution. Each page's
 * unit space is its pixel size at that resolution.
 */
@Component
public class PdfInputLoader implements RawInputLoader {

    private static final Logger log = LoggerFactory.getLogger(PdfInputLoader.class);

    private final int dpi;

    public PdfInputLoader(@Value("${slidemaker.input.pdf-dpi:150}") int dpi) {
        if (dpi < 1) throw new IllegalArgumentException("pdf-dpi must be positive, got " + dpi);
        this.dpi = dpi;
    }

    @Override
    public List<String> extensions() {
        return List.of("pdf");
    }

    @Override
    public List<InputUnit> load(Path source) {
        try (PDDocument document = Loader.loadPDF(source.toFile())) {
            int pageCount = document.getNumberOfPages();
            if (pageCount == 0) {
                throw PipelineException.invalidInput("PDF has no pages: " + source, Map.of("input", source.toString()));
            }

            PDFRenderer renderer = new PDFRenderer(document);
            List<InputUnit> units = new ArrayList<>(pageCount);
            for (int i = 0; i < pageCount; i++) {
                BufferedImage page = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
                units.add(new InputUnit("page-" + (i + 1), i, encodePng(page), "image/png",
                        new CoordinateSpace(page.getWidth(), page.getHeight())));
            }
            log.info("Rasterized {} page(s) of {} at {} dpi", pageCount, source.getFileName(), dpi);
            return units;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not rasterize PDF " + source, e);
        }
    }

    private static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
