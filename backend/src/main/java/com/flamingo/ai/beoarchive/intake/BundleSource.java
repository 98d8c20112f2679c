package com.flamingo.ai.beoarchive.intake;

import com.flamingo.ai.beoarchive.pipeline.model.AttachmentBundle;
import java.util.List;

/** Supplies the attachment bundles for one archive run. */
public interface BundleSource {

  List<AttachmentBundle> fetchBundles();

  String sourceName();
}
