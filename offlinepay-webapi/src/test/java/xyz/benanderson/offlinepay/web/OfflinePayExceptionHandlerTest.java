package xyz.benanderson.offlinepay.web;

import io.javalin.http.HttpCode;
import org.junit.jupiter.api.Test;
import xyz.benanderson.offlinepay.exception.InsufficientAllowanceException;
import xyz.benanderson.offlinepay.exception.InsufficientBalanceException;
import xyz.benanderson.offlinepay.exception.InvalidVoucherException;
import xyz.benanderson.offlinepay.exception.MalformedVoucherException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.voucher.VerificationFailure;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OfflinePayExceptionHandlerTest {

    @Test
    void testStatusOf() {
        assertEquals(HttpCode.BAD_REQUEST, OfflinePayExceptionHandler.statusOf(new ValidationException("bad")));
        assertEquals(HttpCode.BAD_REQUEST, OfflinePayExceptionHandler.statusOf(new MalformedVoucherException("bad")));
        assertEquals(HttpCode.UNPROCESSABLE_ENTITY,
                OfflinePayExceptionHandler.statusOf(new InvalidVoucherException(VerificationFailure.EXPIRED)));
        assertEquals(HttpCode.CONFLICT, OfflinePayExceptionHandler.statusOf(
                new InsufficientAllowanceException("0x0", BigDecimal.TEN, BigDecimal.ONE)));
        assertEquals(HttpCode.CONFLICT, OfflinePayExceptionHandler.statusOf(
                new InsufficientBalanceException(BigDecimal.TEN, BigDecimal.ONE)));
        assertEquals(HttpCode.INTERNAL_SERVER_ERROR,
                OfflinePayExceptionHandler.statusOf(new StorageException("disk")));
    }

}
