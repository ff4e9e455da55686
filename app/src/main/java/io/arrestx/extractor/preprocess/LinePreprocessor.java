package io.arrestx.extractor.preprocess;

import io.arrestx.extractor.model.SourcePage;
import java.util.List;

/**
 * Cleans raw page text into the whitespace-normalized, header-free lines the extraction engine expects.
 */
public interface LinePreprocessor {

    List<SourcePage> preprocess(List<SourcePage> pages);
}
