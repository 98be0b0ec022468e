package com.unitutor.courseware.service;

import com.unitutor.courseware.model.GeneratorConfig;
import com.unitutor.courseware.model.RunAdmission;

import java.util.List;

public interface ProcessingService {
    RunAdmission startRun(String documentId, List<Integer> pageNumbers, GeneratorConfig generatorConfig);
    boolean cancelRun(String documentId);
    boolean isRunning(String documentId);
}
