package com.eyelevel.pdfcompressor.consumer;

import com.eyelevel.pdfcompressor.service.dispatch.JobDispatcher;
import com.eyelevel.pdfcompressor.service.dispatch.JobQueuePublisher;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspace;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspaceFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompressionJobConsumerTest {

    @Mock
    private JobDispatcher jobDispatcher;
    @Mock
    private JobWorkspaceFactory workspaceFactory;
    @InjectMocks
    private CompressionJobConsumer consumer;

    @Test
    void runsTheNamedJobWithItsFiles() {
        final UUID jobId = UUID.randomUUID();
        final JobWorkspace workspace = mock(JobWorkspace.class);
        when(workspaceFactory.attach(jobId.toString(), Paths.get("/shared/in.pdf"), Paths.get("/shared/out.pdf")))
                .thenReturn(workspace);

        consumer.processJobMessage(Map.of(JobQueuePublisher.JOB_ID, jobId.toString(),
                                          JobQueuePublisher.INPUT_PATH, "/shared/in.pdf",
                                          JobQueuePublisher.OUTPUT_PATH, "/shared/out.pdf"));

        verify(jobDispatcher).executeDetached(jobId, workspace);
    }

    @Test
    void invalidMessagesAreDropped() {
        consumer.processJobMessage(Map.of(JobQueuePublisher.JOB_ID, "not-a-uuid",
                                          JobQueuePublisher.INPUT_PATH, "/shared/in.pdf",
                                          JobQueuePublisher.OUTPUT_PATH, "/shared/out.pdf"));
        consumer.processJobMessage(Map.of(JobQueuePublisher.JOB_ID, UUID.randomUUID().toString()));

        verify(jobDispatcher, never()).executeDetached(any(), any());
    }
}
