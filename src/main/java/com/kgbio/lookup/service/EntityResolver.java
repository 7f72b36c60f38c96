package com.kgbio.lookup.service;

import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.model.Identifier;
import org.springframework.stereotype.Service;

@Service
public class EntityResolver extends CandidateResolver {
    public EntityResolver(WikidataSearchClient searchClient, WikidataProperties props) {
        super(searchClient, props, Identifier.Kind.ENTITY);
    }
}
