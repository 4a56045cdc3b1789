package org.xcos.csp.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.xcos.csp.model.CSPModel;
import org.xcos.csp.model.ExplanationRequest;
import org.xcos.csp.model.SolveRequest;
import org.xcos.csp.output.ExplanationResult;
import org.xcos.csp.output.ModelStoredResponse;
import org.xcos.csp.output.SolveResult;
import org.xcos.csp.service.ConflictExplainer;
import org.xcos.csp.service.ModelService;
import org.xcos.csp.service.SolverService;

@RestController
@RequestMapping("/api")
public class SolveController {

    private final ModelService modelService;
    private final SolverService solverService;
    private final ConflictExplainer conflictExplainer;

    public SolveController(ModelService modelService, SolverService solverService, ConflictExplainer conflictExplainer) {
        this.modelService = modelService;
        this.solverService = solverService;
        this.conflictExplainer = conflictExplainer;
    }

    /**
     * Solve a stored CSP model.
     *
     * Usage:
     *   curl -X POST -H 'Content-Type: application/json' \
     *        -d '{"model_id": "model-123", "timeout": 30, "find_all": false}' http://localhost:8000/api/solve
     *
     * @param request model id, timeout in seconds and find_all flag
     * @return status, solution and timing; failures while solving come back as status "error"
     */
    @PostMapping("/solve")
    public ResponseEntity<SolveResult> solveModel(@RequestBody SolveRequest request) {
        CSPModel model = modelService.getModel(request.getModelId());
        return ResponseEntity.ok(solverService.solve(model, request.getTimeout(), request.isFindAll()));
    }

    /**
     * Create or update a CSP model, keyed by its id.
     */
    @PostMapping("/model")
    public ResponseEntity<ModelStoredResponse> createModel(@RequestBody CSPModel model) {
        return ResponseEntity.ok(modelService.storeModel(model));
    }

    /**
     * Create or update a CSP model from an uploaded YAML file.
     *
     * Usage:
     *   curl -F file=@/path/to/model.yml http://localhost:8000/api/model/import
     */
    @PostMapping(value = "/model/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ModelStoredResponse> importModel(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(modelService.importModel(file));
    }

    @GetMapping("/model/{modelId}")
    public ResponseEntity<CSPModel> getModel(@PathVariable String modelId) {
        return ResponseEntity.ok(modelService.getModel(modelId));
    }

    /**
     * Explain the unsatisfiability of a stored model with a MUS or an MCS of its constraints.
     */
    @PostMapping("/explain")
    public ResponseEntity<ExplanationResult> explain(@RequestBody ExplanationRequest request) {
        CSPModel model = modelService.getModel(request.getModelId());
        return ResponseEntity.ok(conflictExplainer.explain(model, request.getExplanationType()));
    }
}
