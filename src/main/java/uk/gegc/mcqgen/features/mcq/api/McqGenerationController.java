package uk.gegc.mcqgen.features.mcq.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactDownload;
import uk.gegc.mcqgen.features.mcq.api.dto.McqGenerationResponse;
import uk.gegc.mcqgen.features.mcq.application.McqUploadService;

@RestController
@RequestMapping("/api/v1/mcqs")
@RequiredArgsConstructor
@Tag(name = "MCQ Generation", description = "Generate multiple-choice questions from uploaded documents")
public class McqGenerationController {

    private final McqUploadService uploadService;

    @Operation(summary = "Upload a document and generate MCQs from it",
            description = "Accepts PDF, DOCX or plain-text files. Writes a transcript and a PDF that can be fetched from the download endpoint.")
    @ApiResponse(responseCode = "200", description = "MCQs generated",
            content = @Content(schema = @Schema(implementation = McqGenerationResponse.class)))
    @ApiResponse(responseCode = "400", description = "Invalid file or question count",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @ApiResponse(responseCode = "415", description = "Unsupported document format",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @ApiResponse(responseCode = "422", description = "Document unreadable or no valid MCQs produced",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @ApiResponse(responseCode = "502", description = "Generation service failed",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @ApiResponse(responseCode = "504", description = "Generation service timed out",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @PostMapping(value = "/generate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<McqGenerationResponse> generate(
            @Parameter(description = "Document to generate questions from", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Number of questions to generate", example = "5")
            @RequestParam("numQuestions") int numQuestions) {
        return ResponseEntity.ok(uploadService.generate(file, numQuestions));
    }

    @Operation(summary = "Download a generated transcript or PDF")
    @ApiResponse(responseCode = "200", description = "File content")
    @ApiResponse(responseCode = "404", description = "No such artifact",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @GetMapping("/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        ArtifactDownload download = uploadService.resolveDownload(filename);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(download.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(download.filename()).build().toString())
                .body(new FileSystemResource(download.path()));
    }
}
