package com.flamingo.ai.beoarchive.extraction;

import com.flamingo.ai.beoarchive.exception.TextExtractionException;
import com.flamingo.ai.beoarchive.pipeline.model.ExtractedText;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} backed by Apache PDFBox 3.x.
 *
 * <p>Pages are stripped one at a time so page boundaries survive. Scanned pages without a text
 * layer come back as empty strings rather than failing the document.
 */
@Component
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public ExtractedText extract(String fileName, byte[] content) {
    if (content == null || content.length == 0) {
      throw new TextExtractionException(fileName, "Attachment " + fileName + " is empty");
    }

    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      if (pdfDoc.isEncrypted()) {
        throw new TextExtractionException(fileName, "Attachment " + fileName + " is encrypted");
      }
      List<String> pages = extractPages(pdfDoc);
      log.debug("Extracted {} page(s) from {}", pages.size(), fileName);
      return new ExtractedText(fileName, pages);
    } catch (InvalidPasswordException e) {
      throw new TextExtractionException(
          fileName, "Attachment " + fileName + " is password protected", e);
    } catch (IOException e) {
      log.warn("PDFBox parsing failed for {}: {}", fileName, e.getMessage());
      throw new TextExtractionException(
          fileName, "Failed to parse PDF " + fileName + ": " + e.getMessage(), e);
    }
  }

  private List<String> extractPages(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    int pageCount = pdfDoc.getNumberOfPages();
    List<String> pages = new ArrayList<>(pageCount);
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      pages.add(stripper.getText(pdfDoc).stripTrailing());
    }
    return pages;
  }
}
