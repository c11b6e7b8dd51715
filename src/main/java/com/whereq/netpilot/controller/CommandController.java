package com.whereq.netpilot.controller;

import com.whereq.netpilot.dto.ClassifyRequest;
import com.whereq.netpilot.dto.ClassifyResponse;
import com.whereq.netpilot.safety.CommandCatalog;
import com.whereq.netpilot.safety.CommandMatch;
import com.whereq.netpilot.safety.CommandSafetyClassifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Command classification and suggestions.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/commands")
@RequiredArgsConstructor
@Tag(name = "Commands", description = "Dangerous command classification and suggestions")
public class CommandController {

    private final CommandSafetyClassifier classifier;

    @PostMapping("/classify")
    @Operation(summary = "Classify commands", description = "List the commands that would require confirmation")
    public Mono<ResponseEntity<ClassifyResponse>> classify(@Valid @RequestBody ClassifyRequest request) {
        return Mono.fromCallable(() -> {
            List<CommandMatch> flagged = classifier.inspect(request.getCommands());
            return ResponseEntity.ok(ClassifyResponse.builder()
                .ruleSetVersion(classifier.getRuleSetVersion())
                .confirmationRequired(!flagged.isEmpty())
                .flagged(flagged)
                .build());
        });
    }

    @GetMapping("/suggestions")
    @Operation(summary = "Command suggestions", description = "Read-only commands for a platform (ios, nxos, eos, junos)")
    public Mono<List<String>> suggestions(@RequestParam String platform) {
        return Mono.just(CommandCatalog.suggestionsFor(platform));
    }
}
