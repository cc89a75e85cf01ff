package com.ibprovider.provider.api;

import com.ibprovider.provider.model.DataSourceDescriptor;
import com.ibprovider.provider.model.ReadResult;
import com.ibprovider.provider.service.DataSourceReadService;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the provider's data sources.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/data-sources}: registered data sources with their schemas</li>
 *   <li>{@code POST /api/data-sources/{name}/read}: runs one read with the posted configuration</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/data-sources")
public class DataSourceController {
  private final DataSourceReadService readService;

  public DataSourceController(DataSourceReadService readService) {
    this.readService = readService;
  }

  @GetMapping
  public List<DataSourceDescriptor> list() {
    return readService.describe();
  }

  /**
   * Reads a data source.
   *
   * @param name data source name, for example {@code infoblox_ipv4_network}
   * @param config data source configuration, for example {@code {"filters": {...}}}
   * @return read result; HTTP 422 when the read produced error diagnostics
   */
  @PostMapping("/{name}/read")
  public ResponseEntity<ReadResult> read(
      @PathVariable("name") String name,
      @RequestBody(required = false) Map<String, Object> config) {
    if (config == null) {
      throw new BadRequestException("request body must be a JSON object");
    }
    ReadResult result = readService.read(name, config);
    if (result.diagnostics().hasErrors()) {
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
    return ResponseEntity.ok(result);
  }
}
