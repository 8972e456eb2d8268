package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.ConflictException;
import com.example.JobCopilot.exception.JobNotFoundException;
import com.example.JobCopilot.exception.NotFoundException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.ClientIngestRequest;
import com.example.JobCopilot.model.IngestResult;
import com.example.JobCopilot.model.JobIngestRequest;
import com.example.JobCopilot.model.NoteIngestRequest;
import com.example.JobCopilot.model.PropertyIngestRequest;
import com.example.JobCopilot.repository.ClientRepository;
import com.example.JobCopilot.repository.EquipmentRepository;
import com.example.JobCopilot.repository.JobEventRepository;
import com.example.JobCopilot.repository.JobRepository;
import com.example.JobCopilot.repository.JobSearchIndexRepository;
import com.example.JobCopilot.repository.NoteRepository;
import com.example.JobCopilot.repository.PropertyRepository;
import com.example.JobCopilot.repository.TechnicianRepository;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.support.RecordingBackgroundTaskRunner;
import com.example.JobCopilot.support.TestDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionServiceTest {

    private static final TenantContext TENANT = TenantContext.of("tenant_a");

    private TestDatabase db;
    private RecordingBackgroundTaskRunner runner;
    private VectorIndexingService vectorIndexingService;
    private CopilotProperties properties;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        runner = new RecordingBackgroundTaskRunner();
        vectorIndexingService = mock(VectorIndexingService.class);
        properties = new CopilotProperties();

        ClientRepository clients = new ClientRepository(db.jdbc(), new ObjectMapper());
        PropertyRepository propertyRepository = new PropertyRepository(db.jdbc());
        JobRepository jobs = new JobRepository(db.jdbc(), new ObjectMapper());
        NoteRepository notes = new NoteRepository(db.jdbc());
        JobSearchIndexService search = new JobSearchIndexService(
                jobs,
                new TechnicianRepository(db.jdbc()),
                clients,
                propertyRepository,
                new EquipmentRepository(db.jdbc()),
                notes,
                new JobEventRepository(db.jdbc()),
                new JobSearchIndexRepository(db.jdbc()),
                new CopilotProperties());
        service = new IngestionService(clients, propertyRepository, jobs, notes, search,
                vectorIndexingService, runner, properties);
    }

    @Test
    void clientGetsGeneratedIdAndDefaultType() {
        IngestResult result = service.createClient(TENANT,
                new ClientIngestRequest(null, "  Jordan Whitfield ", null, "512-555-0199", null, List.of("vip", " ", "vip")));

        assertThat(result.id()).isNotBlank();
        assertThat(result.isReplay()).isFalse();
        assertThat(db.jdbc().queryForObject("SELECT type FROM clients WHERE id = ?", String.class, result.id()))
                .isEqualTo("residential");
        assertThat(db.jdbc().queryForObject("SELECT name FROM clients WHERE id = ?", String.class, result.id()))
                .isEqualTo("Jordan Whitfield");
        assertThat(runner.submittedNames()).containsExactly("reindex-client-" + result.id());
    }

    @Test
    void missingRequiredFieldIsNamed() {
        assertThatThrownBy(() -> service.createClient(TENANT, new ClientIngestRequest("c1", " ", null, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Missing name");
        assertThatThrownBy(() -> service.createProperty(TENANT,
                new PropertyIngestRequest(null, "client_1", "1 Main St", null, "Austin", "TX", null, null)))
                .hasMessage("Missing zip");
        assertThatThrownBy(() -> service.createJob(TENANT,
                new JobIngestRequest(null, "client_1", "property_1", null, null, null, null, null)))
                .hasMessage("Missing jobType");
        assertThatThrownBy(() -> service.createNote(TENANT,
                new NoteIngestRequest(null, "job", "job_1", "Text", null, null), null))
                .hasMessage("Missing jobId");
    }

    @Test
    void propertyRequiresClientInTenant() {
        db.client("tenant_b", "client_1", "Other tenant");

        assertThatThrownBy(() -> service.createProperty(TENANT,
                new PropertyIngestRequest("property_1", "client_1", "1 Main St", null, "Austin", "TX", "78701", null)))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Client not found");
    }

    @Test
    void jobDefaultsStatusAndIndexesInBackground() {
        db.client("tenant_a", "client_1", "Jordan")
                .property("tenant_a", "property_1", "client_1", "123 Oak Street", "Austin");

        IngestResult result = service.createJob(TENANT, new JobIngestRequest("job_1", "client_1", "property_1",
                "maintenance", null, "2025-02-10T14:00:00Z", null, "Spring tune-up"));

        assertThat(result.id()).isEqualTo("job_1");
        assertThat(db.jdbc().queryForObject("SELECT status FROM jobs WHERE id = 'job_1'", String.class))
                .isEqualTo("scheduled");
        assertThat(db.count("job_search_index")).isZero();

        runner.runAll();

        assertThat(db.jdbc().queryForObject("SELECT content FROM job_search_index WHERE job_id = 'job_1'", String.class))
                .contains("spring tune-up", "123 oak street");
    }

    @Test
    void jobRejectsInvalidScheduleAndForeignProperty() {
        db.client("tenant_a", "client_1", "Jordan")
                .client("tenant_a", "client_2", "Casey")
                .property("tenant_a", "property_2", "client_2", "9 Pine Road", "Austin");

        assertThatThrownBy(() -> service.createJob(TENANT, new JobIngestRequest(null, "client_1", "property_2",
                "repair", null, "tomorrow", null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid scheduledAt");
        assertThatThrownBy(() -> service.createJob(TENANT, new JobIngestRequest(null, "client_1", "property_2",
                "repair", null, null, null, null)))
                .hasMessage("Property does not belong to client");
        assertThatThrownBy(() -> service.createJob(TENANT, new JobIngestRequest(null, "client_1", "property_x",
                "repair", null, null, null, null)))
                .hasMessage("Property not found");
    }

    @Test
    void noteForMissingJobIsNotFound() {
        assertThatThrownBy(() -> service.createNote(TENANT,
                new NoteIngestRequest(null, "job", "job_missing", "Text", null, "job_missing"), "abc"))
                .isInstanceOf(JobNotFoundException.class);
        assertThat(db.count("notes")).isZero();
        assertThat(runner.submittedNames()).isEmpty();
    }

    @Test
    void noteWithUnknownEntityTypeIsRejected() {
        db.jobGraph("tenant_a", "1", null);

        assertThatThrownBy(() -> service.createNote(TENANT,
                new NoteIngestRequest(null, "equipment", "equip_1", "Text", null, "job_1"), null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid entityType");
    }

    @Test
    void replayedIdempotencyKeyReturnsOriginalNote() {
        db.jobGraph("tenant_a", "1", null);
        NoteIngestRequest request = new NoteIngestRequest(null, "job", "job_1", "Replaced capacitor", null, "job_1");

        IngestResult first = service.createNote(TENANT, request, "abc");
        IngestResult second = service.createNote(TENANT, request, "abc");

        assertThat(first.isReplay()).isFalse();
        assertThat(second.isReplay()).isTrue();
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(db.count("notes")).isEqualTo(1);
        assertThat(db.jdbc().queryForObject("SELECT note_type FROM notes", String.class)).isEqualTo("tech");
        assertThat(runner.submittedNames()).containsExactly("reindex-note-" + first.id());
    }

    @Test
    void sameKeyInAnotherTenantIsIndependent() {
        db.jobGraph("tenant_a", "1", null).jobGraph("tenant_b", "1", null);
        NoteIngestRequest request = new NoteIngestRequest(null, "job", "job_1", "Checked refrigerant", null, "job_1");

        IngestResult ours = service.createNote(TENANT, request, "abc");
        IngestResult theirs = service.createNote(TenantContext.of("tenant_b"), request, "abc");

        assertThat(theirs.isReplay()).isFalse();
        assertThat(theirs.id()).isNotEqualTo(ours.id());
        assertThat(db.count("notes")).isEqualTo(2);
    }

    @Test
    void collidingIdWithFreshKeyIsAConflict() {
        db.jobGraph("tenant_a", "1", null)
                .note("tenant_a", "note_1", "job", "job_1", "Existing", null, Instant.parse("2024-01-01T00:00:00Z"));

        assertThatThrownBy(() -> service.createNote(TENANT,
                new NoteIngestRequest("note_1", "job", "job_1", "Different", null, "job_1"), "fresh-key"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Idempotency key already used");
    }

    @Test
    void noteReindexesSearchAndVectorsWhenConfigured() {
        db.jobGraph("tenant_a", "1", null);
        properties.getVector().setEnabled(true);
        properties.getModel().setApiKey("sk-test");

        service.createNote(new TenantContext("tenant_a", null, null),
                new NoteIngestRequest(null, "job", "job_1", "Blower wheel cleaned", null, "job_1"), null);
        runner.runAll();

        assertThat(db.jdbc().queryForObject("SELECT content FROM job_search_index WHERE job_id = 'job_1'", String.class))
                .contains("blower wheel cleaned");
        verify(vectorIndexingService).reindexJobEvidence("tenant_a", "job_1");
    }

    @Test
    void vectorReindexIsSkippedWhenNotConfigured() {
        db.jobGraph("tenant_a", "1", null);

        service.createNote(TENANT, new NoteIngestRequest(null, "job", "job_1", "Filter swapped", null, "job_1"), null);
        runner.runAll();

        verify(vectorIndexingService, never()).reindexJobEvidence(anyString(), anyString());
    }

    @Test
    void vanishedJobDuringVectorReindexIsLogged() {
        db.jobGraph("tenant_a", "1", null);
        properties.getVector().setEnabled(true);
        properties.getModel().setApiKey("sk-test");
        when(vectorIndexingService.reindexJobEvidence("tenant_a", "job_1"))
                .thenThrow(new JobNotFoundException("tenant_a", "job_1"));

        service.createNote(TENANT, new NoteIngestRequest(null, "job", "job_1", "Coil cleaned", null, "job_1"), null);
        runner.runAll();

        verify(vectorIndexingService).reindexJobEvidence("tenant_a", "job_1");
    }
}
