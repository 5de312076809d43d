/* (C)2026 */
package com.ammann.dashboard.resource;

import com.ammann.dashboard.dto.AnalysisResponseDTO;
import com.ammann.dashboard.dto.UploadSummaryDTO;
import com.ammann.dashboard.enumeration.ChartKind;
import com.ammann.dashboard.exception.ValidationException;
import com.ammann.dashboard.model.RawTable;
import com.ammann.dashboard.properties.ApiProperties;
import com.ammann.dashboard.service.AnalysisPipelineService;
import com.ammann.dashboard.service.ChartPlanningService;
import com.ammann.dashboard.service.NarrativeService;
import com.ammann.dashboard.service.TableParsingService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.List;

/**
 * REST resource for uploading tabular files and analyzing them.
 *
 * <p>Both POST endpoints take a multipart form with a single {@code file} part. The upload
 * endpoint returns a structural summary of the cleaned table; the analyze endpoint returns
 * the chart plan, the statistical profile and a short narrative.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Datasets.BASE)
@Tag(name = "Dataset API", description = "Automatic cleaning, profiling and chart planning for uploaded tables")
@Produces(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject
    TableParsingService parsingService;

    @Inject
    AnalysisPipelineService pipelineService;

    @Inject
    ChartPlanningService chartPlanningService;

    @Inject
    NarrativeService narrativeService;

    @POST
    @Path(ApiProperties.Datasets.UPLOAD)
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(
            summary = "Upload a dataset",
            description = "Parses and cleans a CSV or Excel file and returns its structural summary"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "File parsed and cleaned",
                    content = @Content(schema = @Schema(implementation = UploadSummaryDTO.class))),
            @APIResponse(responseCode = "400", description = "Missing, empty, oversized or unsupported file"),
            @APIResponse(responseCode = "422", description = "Malformed table"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response upload(
            @Parameter(description = "CSV, XLSX or XLS file whose first row is the header")
            @RestForm("file") FileUpload file) {

        String filename = filenameOf(file);
        LOG.debugf("Upload request: file=%s", filename);

        RawTable raw = parsingService.parse(readContent(file), filename);
        UploadSummaryDTO summary = pipelineService.summarize(filename, raw);

        LOG.infof("Upload of '%s' summarized: %d rows x %d columns",
                filename, summary.rows(), summary.columns());
        return Response.ok(summary).build();
    }

    @POST
    @Path(ApiProperties.Datasets.ANALYZE)
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(
            summary = "Analyze a dataset",
            description = "Cleans a CSV or Excel file, profiles it and plans the charts of an overview dashboard"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed",
                    content = @Content(schema = @Schema(implementation = AnalysisResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Missing, empty, oversized or unsupported file"),
            @APIResponse(responseCode = "422", description = "Malformed table"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyze(
            @Parameter(description = "CSV, XLSX or XLS file whose first row is the header")
            @RestForm("file") FileUpload file) {

        String filename = filenameOf(file);
        LOG.debugf("Analyze request: file=%s", filename);

        RawTable raw = parsingService.parse(readContent(file), filename);
        AnalysisPipelineService.AnalysisResult result = pipelineService.run(raw);

        var response = new AnalysisResponseDTO(
                true,
                result.charts(),
                result.profile(),
                narrativeService.describe(result.profile())
        );

        LOG.infof("Analysis of '%s' completed: %d charts", filename, result.charts().size());
        return Response.ok(response).build();
    }

    @GET
    @Path(ApiProperties.Datasets.CHART_KINDS)
    @Operation(
            summary = "List chart kinds",
            description = "Returns the chart families the planner can emit, in planning order"
    )
    public Response getChartKinds() {
        List<ChartKind> kinds = chartPlanningService.supportedKinds();
        return Response.ok(kinds).build();
    }

    private static String filenameOf(FileUpload file) {
        if (file == null) {
            throw ValidationException.invalidParameter("file", null, "a multipart file part named 'file'");
        }
        return file.fileName();
    }

    private static byte[] readContent(FileUpload file) {
        try {
            return Files.readAllBytes(file.uploadedFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read uploaded file " + file.fileName(), e);
        }
    }
}
