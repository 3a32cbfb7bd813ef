package com.flamingo.ai.knowledgehub.api.rest;

import com.flamingo.ai.knowledgehub.api.dto.request.PushRecordRequest;
import com.flamingo.ai.knowledgehub.api.dto.request.SyncRequest;
import com.flamingo.ai.knowledgehub.api.dto.response.SyncResponse;
import com.flamingo.ai.knowledgehub.service.sync.DeleteResult;
import com.flamingo.ai.knowledgehub.service.sync.PushResult;
import com.flamingo.ai.knowledgehub.service.sync.ReembedResult;
import com.flamingo.ai.knowledgehub.service.sync.SyncOptions;
import com.flamingo.ai.knowledgehub.service.sync.SyncService;
import com.flamingo.ai.knowledgehub.service.sync.SyncStatusReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the Airtable sync engine. */
@RestController
@RequestMapping("/api/airtable")
@RequiredArgsConstructor
public class AirtableSyncController {

  private final SyncService syncService;

  /** Runs a sync; the body is optional. */
  @PostMapping("/sync")
  public ResponseEntity<SyncResponse> sync(@RequestBody(required = false) SyncRequest request) {
    SyncOptions options = request != null ? request.toOptions() : SyncOptions.defaults();
    return ResponseEntity.ok(SyncResponse.from(syncService.syncAll(options)));
  }

  /** Configuration state, last run and per-table counts. */
  @GetMapping("/sync")
  public ResponseEntity<SyncStatusReport> status() {
    return ResponseEntity.ok(syncService.getStatus());
  }

  /** Re-embeds every synced record of a table. */
  @PostMapping("/sync/reembed")
  public ResponseEntity<ReembedResult> reembed(@RequestParam("table") String tableName) {
    return ResponseEntity.ok(syncService.reembedTable(tableName));
  }

  /** Deletes the synced records of a table. */
  @DeleteMapping("/records")
  public ResponseEntity<DeleteResult> deleteRecords(@RequestParam("table") String tableName) {
    return ResponseEntity.ok(syncService.deleteTable(tableName));
  }

  /** Writes one record back to Airtable. */
  @PostMapping("/records")
  public ResponseEntity<PushResult> push(@Valid @RequestBody PushRecordRequest request) {
    PushResult result =
        syncService.push(request.getTableName(), request.getRecordId(), request.getFields());
    return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY)
        .body(result);
  }
}
