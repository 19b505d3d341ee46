package com.clan.clears.controller;

import com.clan.clears.dto.CommonResponse;
import com.clan.clears.dto.PostGameReport;
import com.clan.clears.service.PgcrService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PgcrController {

    private final PgcrService pgcrService;

    /**
     * GET /pgcr?instanceId=ID
     */
    @GetMapping("/pgcr")
    public ResponseEntity<CommonResponse<PostGameReport>> getReport(@RequestParam String instanceId) {
        return ResponseEntity.ok(CommonResponse.success(pgcrService.getReport(instanceId)));
    }
}
