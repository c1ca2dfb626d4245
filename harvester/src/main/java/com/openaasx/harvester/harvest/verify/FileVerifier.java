package com.openaasx.harvester.harvest.verify;

import java.nio.file.Path;

public interface FileVerifier {

    VerificationReport verify(Path file, String sha256);
}
