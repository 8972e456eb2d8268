package com.example.JobCopilot.service;

import com.example.JobCopilot.exception.NotFoundException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.Technician;
import com.example.JobCopilot.model.TechnicianCreateRequest;
import com.example.JobCopilot.model.TechnicianList;
import com.example.JobCopilot.repository.TechnicianRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static com.example.JobCopilot.util.RequestFields.optional;
import static com.example.JobCopilot.util.RequestFields.orDefault;

/**
 * Tenant staff directory. Technicians are plain users; role defaults to {@code technician}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TechnicianService {

    static final String DEFAULT_ROLE = "technician";

    private final TechnicianRepository technicianRepository;

    public TechnicianList listTechnicians(String tenantId, String search, String role) {
        List<Technician> technicians = technicianRepository.search(tenantId, optional(search), optional(role));
        return new TechnicianList(technicians, technicians.size());
    }

    public Technician getTechnician(String tenantId, String technicianId) {
        return technicianRepository.findById(tenantId, technicianId)
                .orElseThrow(() -> new NotFoundException("Technician not found"));
    }

    /** @return id of the new technician */
    public String createTechnician(String tenantId, TechnicianCreateRequest request) {
        String email = request == null ? null : optional(request.email());
        String firstName = request == null ? null : optional(request.firstName());
        String lastName = request == null ? null : optional(request.lastName());
        if (email == null || firstName == null || lastName == null) {
            throw new ValidationException("Missing email, firstName, or lastName");
        }

        String id = UUID.randomUUID().toString();
        technicianRepository.insert(tenantId, new Technician(
                id,
                firstName,
                lastName,
                email.toLowerCase(Locale.ROOT),
                orDefault(request.role(), DEFAULT_ROLE),
                optional(request.phone()),
                Instant.now()));
        log.info("Created technician {} in tenant {}", id, tenantId);
        return id;
    }
}
