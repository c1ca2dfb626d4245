package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.harvest.model.FailureKind;

public class TooManyRedirectsException extends DownloadException {

    public TooManyRedirectsException(String url, int maxRedirects) {
        super(FailureKind.RESOURCE_LIMIT, "Too many redirects (> " + maxRedirects + ") starting at " + url);
    }
}
