package com.fleetledger.web;

import com.fleetledger.config.SecurityConfig;
import com.fleetledger.controller.AdminInvoiceController;
import com.fleetledger.dto.InvoiceComputationResult;
import com.fleetledger.dto.InvoiceCreationOptions;
import com.fleetledger.dto.InvoiceLine;
import com.fleetledger.dto.InvoiceTotals;
import com.fleetledger.dto.VatBucket;
import com.fleetledger.exception.NoCustomerFoundException;
import com.fleetledger.model.Customer;
import com.fleetledger.model.WeeklyLog;
import com.fleetledger.repository.CustomerRepository;
import com.fleetledger.repository.WeeklyLogRepository;
import com.fleetledger.service.InvoiceAssembler;
import com.fleetledger.service.InvoiceRequestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AdminInvoiceController.class)
@Import({SecurityConfig.class, InvoiceRequestService.class})
class AdminInvoiceControllerWebTests {

    @Autowired MockMvc mvc;

    @MockBean WeeklyLogRepository weeklyLogRepository;
    @MockBean CustomerRepository customerRepository;
    @MockBean InvoiceAssembler invoiceAssembler;

    private WeeklyLog weeklyLog;

    private static final String BODY = "{\"weekId\":\"2025-06\",\"driverId\":\"driver-1\"}";

    @BeforeEach
    void setup() {
        weeklyLog = new WeeklyLog();
        weeklyLog.setWeekId("2025-06");
        weeklyLog.setDriverId("driver-1");
        when(weeklyLogRepository.findByWeekIdAndDriverId("2025-06", "driver-1")).thenReturn(Optional.of(weeklyLog));
    }

    private static InvoiceComputationResult result(Long invoiceId) {
        InvoiceLine line = new InvoiceLine(new BigDecimal("3"), "Maandag 03-02-2025\nKilometers",
                new BigDecimal("0.333333"), new BigDecimal("21"));
        BigDecimal sub = line.getTotal();
        BigDecimal vat = sub.multiply(new BigDecimal("0.21"));
        InvoiceTotals totals = new InvoiceTotals(sub, List.of(new VatBucket(new BigDecimal("21"), sub, vat)), vat, sub.add(vat));
        return new InvoiceComputationResult(List.of(line), totals, List.of(), 7L, "Transport BV", invoiceId);
    }

    @Test
    void previewRoundsMoneyOnlyInJson() throws Exception {
        when(invoiceAssembler.createInvoice(eq(weeklyLog), isNull(), isNull(), any(InvoiceCreationOptions.class)))
                .thenReturn(result(null));

        mvc.perform(post("/admin/invoices/preview").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lines[0].quantity").value(3))
                .andExpect(jsonPath("$.lines[0].unitPrice").value(0.333333))
                .andExpect(jsonPath("$.lines[0].total").value(1.0))
                .andExpect(jsonPath("$.subTotal").value(1.0))
                .andExpect(jsonPath("$.vatTotal").value(0.21))
                .andExpect(jsonPath("$.grandTotal").value(1.21))
                .andExpect(jsonPath("$.vatBreakdown[0].base").value(1.0))
                .andExpect(jsonPath("$.customerName").value("Transport BV"))
                .andExpect(jsonPath("$.invoiceId").value(nullValue()));

        ArgumentCaptor<InvoiceCreationOptions> options = ArgumentCaptor.forClass(InvoiceCreationOptions.class);
        verify(invoiceAssembler).createInvoice(eq(weeklyLog), isNull(), isNull(), options.capture());
        assertThat(options.getValue().isCreateInvoice()).isFalse();
    }

    @Test
    void createPersistsAndPassesParsedRateAndCustomer() throws Exception {
        Customer customer = new Customer();
        customer.setId(7L);
        when(customerRepository.findById(7L)).thenReturn(Optional.of(customer));
        when(invoiceAssembler.createInvoice(eq(weeklyLog), eq(customer), any(BigDecimal.class), any(InvoiceCreationOptions.class)))
                .thenReturn(result(99L));

        mvc.perform(post("/admin/invoices").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weekId\":\"2025-06\",\"driverId\":\"driver-1\",\"customerId\":7,"
                                + "\"weeklyRate\":\"12,5\",\"reference\":\"PO-1\",\"invoiceDate\":\"2025-02-10\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.invoiceId").value(99));

        ArgumentCaptor<BigDecimal> rate = ArgumentCaptor.forClass(BigDecimal.class);
        ArgumentCaptor<InvoiceCreationOptions> options = ArgumentCaptor.forClass(InvoiceCreationOptions.class);
        verify(invoiceAssembler).createInvoice(eq(weeklyLog), eq(customer), rate.capture(), options.capture());
        assertThat(rate.getValue()).isEqualByComparingTo("12.5");
        assertThat(options.getValue().isCreateInvoice()).isTrue();
        assertThat(options.getValue().getReference()).isEqualTo("PO-1");
        assertThat(options.getValue().getInvoiceDate()).hasToString("2025-02-10");
    }

    @Test
    void nonNumericWeeklyRateIsIgnoredWithWarning() throws Exception {
        when(invoiceAssembler.createInvoice(eq(weeklyLog), isNull(), isNull(), any(InvoiceCreationOptions.class)))
                .thenReturn(result(null));

        mvc.perform(post("/admin/invoices/preview").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weekId\":\"2025-06\",\"driverId\":\"driver-1\",\"weeklyRate\":\"tien\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warnings[0]").value("Ongeldig weektarief genegeerd: tien"));
    }

    @Test
    void malformedWeekIdIsBadRequest() throws Exception {
        mvc.perform(post("/admin/invoices/preview").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weekId\":\"week 6\",\"driverId\":\"driver-1\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(invoiceAssembler);
    }

    @Test
    void unresolvedCustomerIsUnprocessable() throws Exception {
        when(invoiceAssembler.createInvoice(any(), any(), any(), any()))
                .thenThrow(new NoCustomerFoundException("2025-06", List.of("ZZ-999-Z")));

        mvc.perform(post("/admin/invoices").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value("Geen klant gevonden voor kenteken in weekstaat."))
                .andExpect(jsonPath("$.licensePlates[0]").value("ZZ-999-Z"));
    }

    @Test
    void internalArgumentFaultIsNotReportedAsBadRequest() {
        when(invoiceAssembler.createInvoice(any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Unknown toll code: XX"));

        assertThatThrownBy(() -> mvc.perform(post("/admin/invoices/preview").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON).content(BODY)))
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownWeeklyLogIsNotFound() throws Exception {
        mvc.perform(post("/admin/invoices/preview").with(user("admin").roles("ADMIN")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weekId\":\"2025-07\",\"driverId\":\"driver-1\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void nonAdminIsForbidden() throws Exception {
        mvc.perform(post("/admin/invoices/preview").with(user("driver").roles("DRIVER")).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isForbidden());
    }

    @Test
    void anonymousIsUnauthorized() throws Exception {
        mvc.perform(post("/admin/invoices/preview").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized());
    }
}
