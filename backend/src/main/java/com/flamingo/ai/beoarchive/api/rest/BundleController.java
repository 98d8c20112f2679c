package com.flamingo.ai.beoarchive.api.rest;

import com.flamingo.ai.beoarchive.api.dto.response.BundleOutcomeResponse;
import com.flamingo.ai.beoarchive.exception.BundleIntakeException;
import com.flamingo.ai.beoarchive.pipeline.BeoPipelineService;
import com.flamingo.ai.beoarchive.pipeline.model.Attachment;
import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import com.flamingo.ai.beoarchive.pipeline.model.BundleOutcome;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller that runs one uploaded bundle through the archive pipeline. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class BundleController {

  private final BeoPipelineService pipelineService;

  /** Processes the uploaded files as a single bundle. */
  @PostMapping(value = "/bundles", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<BundleOutcomeResponse> processBundle(
      @RequestParam("files") List<MultipartFile> files,
      @RequestParam(value = "subject", required = false) String subject) {
    AttachmentBundle bundle =
        new AttachmentBundle(
            "upload-" + UUID.randomUUID().toString().substring(0, 8),
            subject,
            Instant.now(),
            toAttachments(files));
    BundleOutcome outcome = pipelineService.process(bundle);
    return ResponseEntity.ok(BundleOutcomeResponse.fromOutcome(outcome));
  }

  private List<Attachment> toAttachments(List<MultipartFile> files) {
    List<Attachment> attachments = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      try {
        attachments.add(
            new Attachment(file.getOriginalFilename(), file.getBytes(), file.getContentType()));
      } catch (IOException e) {
        throw new BundleIntakeException(
            "Failed to read uploaded file " + file.getOriginalFilename(), e);
      }
    }
    return attachments;
  }
}
