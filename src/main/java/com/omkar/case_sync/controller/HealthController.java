package com.omkar.case_sync.controller;

import com.omkar.case_sync.store.CaseStore;
import com.omkar.case_sync.sync.CaseSynchronizer;
import com.omkar.case_sync.sync.SyncScheduler;
import com.omkar.case_sync.sync.SyncStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final CaseSynchronizer caseSynchronizer;
    private final SyncScheduler syncScheduler;
    private final CaseStore caseStore;

    public HealthController(CaseSynchronizer caseSynchronizer, SyncScheduler syncScheduler, CaseStore caseStore){
        this.caseSynchronizer=caseSynchronizer;
        this.syncScheduler=syncScheduler;
        this.caseStore=caseStore;
    }

    @GetMapping("/health")
    public String health(){
        return "OK";
    }

    @GetMapping("/sync/status")
    public Map<String, Object> syncStatus(){
        SyncStatus status = caseSynchronizer.getStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", syncScheduler.isRunning());
        body.put("localCases", caseStore.count());
        body.put("status", status);
        return body;
    }
}
