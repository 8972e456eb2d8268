package com.example.JobCopilot.model;

import java.util.List;

public record TechnicianList(List<Technician> technicians, int total) {
}
