package com.kgbio.lookup.controller;

import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.dto.LookupDtos;
import com.kgbio.lookup.model.Bio;
import com.kgbio.lookup.model.LookupRequest;
import com.kgbio.lookup.model.YearFilter;
import com.kgbio.lookup.service.CoachLookupService;
import com.kgbio.lookup.service.PersonBioService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class LookupController {
    private final CoachLookupService coachLookupService;
    private final PersonBioService personBioService;
    private final WikidataProperties props;

    public LookupController(CoachLookupService coachLookupService, PersonBioService personBioService, WikidataProperties props) {
        this.coachLookupService = coachLookupService;
        this.personBioService = personBioService;
        this.props = props;
    }

    /**
     * 200 with the biography and the matched statement row, 404 with a reason when the entity,
     * the property or a matching statement could not be found.
     */
    @PostMapping(value = "/lookup", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<LookupDtos.LookupResponseBody>> lookup(@Valid @RequestBody LookupDtos.LookupRequestBody body) {
        return Mono.fromCallable(() -> new LookupRequest(body.getEntity(), body.getProperty(),
                        YearFilter.ofNullable(body.getYear()), languageOrDefault(body.getLanguage())))
                .flatMap(coachLookupService::lookup)
                .map(outcome -> {
                    LookupDtos.LookupResponseBody response = LookupDtos.LookupResponseBody.from(outcome);
                    return outcome.isFound()
                            ? ResponseEntity.ok(response)
                            : ResponseEntity.status(404).body(response);
                });
    }

    @GetMapping(value = "/bio/{qid}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Bio> bio(@PathVariable String qid, @RequestParam(required = false) String language) {
        return personBioService.fetchBio(qid, languageOrDefault(language));
    }

    private String languageOrDefault(String language) {
        return language == null || language.isBlank() ? props.getDefaultLanguage() : language.trim();
    }
}
