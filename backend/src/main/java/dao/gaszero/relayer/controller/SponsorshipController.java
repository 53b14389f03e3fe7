package dao.gaszero.relayer.controller;

import dao.gaszero.relayer.model.SponsorshipRequest;
import dao.gaszero.relayer.service.SponsorshipService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/sponsorship")
public class SponsorshipController {

    private final SponsorshipService sponsorshipService;

    public SponsorshipController(SponsorshipService sponsorshipService) {
        this.sponsorshipService = sponsorshipService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> fund(@Valid @RequestBody SponsorshipRequest body) {
        return ResponseEntity.ok(sponsorshipService.fund(body));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(sponsorshipService.status());
    }
}
