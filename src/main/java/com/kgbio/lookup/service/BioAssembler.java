package com.kgbio.lookup.service;

import com.kgbio.lookup.model.Bio;
import com.kgbio.lookup.model.CoreFacts;
import com.kgbio.lookup.model.Identifier;
import com.kgbio.lookup.model.ListsByKind;
import com.kgbio.lookup.model.TimelineByKind;
import com.kgbio.lookup.util.EntityUris;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class BioAssembler {
    private final RagTextRenderer renderer;

    public BioAssembler(RagTextRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Composes the parts into a {@link Bio}. The person's URI and QID come from the core row
     * when it has one; otherwise the requested {@code qid} is used.
     */
    public Bio assemble(Identifier qid, CoreFacts core, ListsByKind lists, TimelineByKind timeline) {
        CoreFacts c = core == null ? CoreFacts.empty() : core;
        ListsByKind l = lists == null ? ListsByKind.empty() : lists;
        TimelineByKind t = timeline == null ? TimelineByKind.empty() : timeline;

        String id = c.id() != null ? c.id() : qid.value();
        Identifier resolvedQid = Objects.requireNonNullElse(EntityUris.qidFromUri(c.id()), qid);
        return new Bio(id, resolvedQid, c.label(), c.description(), c, l, t, renderer.render(c, l, t));
    }
}
