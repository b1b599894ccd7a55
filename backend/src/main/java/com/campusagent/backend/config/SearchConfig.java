package com.campusagent.backend.config;

import com.campusagent.backend.service.AtlasVectorSearchIndex;
import com.campusagent.backend.service.CatalogScanIndex;
import com.campusagent.backend.service.FallbackSimilarityIndex;
import com.campusagent.backend.service.SimilarityIndex;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class SearchConfig {

    /**
     * Index used by the assistant: Atlas vector search, with the local catalog scan behind it.
     */
    @Bean
    @Primary
    public SimilarityIndex similarityIndex(AtlasVectorSearchIndex atlasVectorSearchIndex,
            CatalogScanIndex catalogScanIndex) {
        return new FallbackSimilarityIndex(atlasVectorSearchIndex, catalogScanIndex);
    }
}
