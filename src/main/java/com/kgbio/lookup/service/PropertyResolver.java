package com.kgbio.lookup.service;

import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.model.Identifier;
import org.springframework.stereotype.Service;

@Service
public class PropertyResolver extends CandidateResolver {
    public PropertyResolver(WikidataSearchClient searchClient, WikidataProperties props) {
        super(searchClient, props, Identifier.Kind.PROPERTY);
    }
}
