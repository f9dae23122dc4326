package com.github.dimitryivaniuta.cmdb.scheduler;

import com.github.dimitryivaniuta.cmdb.error.CmdbException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import org.springframework.http.HttpStatus;

import java.util.List;

public class PollingInProgressException extends CmdbException {

    public static final String CODE = "POLLING_IN_PROGRESS";

    public PollingInProgressException(String message) {
        super(HttpStatus.CONFLICT, message, List.of(ErrorDetail.of(CODE, message)));
    }
}
