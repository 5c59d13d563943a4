package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ErrorClass;
import com.questrail.bacnet.api.ErrorCode;

/**
 * Per-property read failure inside a ReadPropertyMultiple acknowledgement.
 */
public record PropertyAccessError(ErrorClass errorClass, ErrorCode errorCode)
{
}
