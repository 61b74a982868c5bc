package com.fleetledger.service;

import com.fleetledger.Fixtures;
import com.fleetledger.exception.NoCustomerFoundException;
import com.fleetledger.model.BillingType;
import com.fleetledger.model.Customer;
import com.fleetledger.model.DayStatus;
import com.fleetledger.model.WeeklyLog;
import com.fleetledger.repository.CustomerRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fleetledger.Fixtures.MONDAY;
import static com.fleetledger.Fixtures.dayWithStatus;
import static com.fleetledger.Fixtures.workedDay;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CustomerResolverTest {

    private final CustomerRepository repository = mock(CustomerRepository.class);
    private final CustomerResolver resolver = new CustomerResolver(repository);

    @Test
    void majorityOverWorkedDaysOnly() {
        // two sick days on the other truck do not outvote the worked ones
        WeeklyLog log = Fixtures.weeklyLog("d1",
                workedDay(MONDAY, "AA-11-AA"),
                dayWithStatus(MONDAY.plusDays(1), DayStatus.SICK, "BB-22-BB"),
                dayWithStatus(MONDAY.plusDays(2), DayStatus.SICK, "BB-22-BB"),
                workedDay(MONDAY.plusDays(3), "AA-11-AA"),
                workedDay(MONDAY.plusDays(4), "CC-33-CC"));
        Customer owner = Fixtures.customer("Eigenaar", BillingType.HOURLY, "AA-11-AA");
        when(repository.findByAssignedLicensePlate("AA-11-AA")).thenReturn(List.of(owner));

        assertThat(resolver.resolve(log)).containsSame(owner);
        assertThat(CustomerResolver.majorityPlate(log.getDays(), false)).contains("AA-11-AA");
    }

    @Test
    void tieGoesToFirstPlateInLog() {
        WeeklyLog log = Fixtures.weeklyLog("d1",
                workedDay(MONDAY, "BB-22-BB"),
                workedDay(MONDAY.plusDays(1), "AA-11-AA"));

        assertThat(CustomerResolver.majorityPlate(log.getDays(), true)).contains("BB-22-BB");
    }

    @Test
    void sharedPlateUsesFirstCustomerReturned() {
        Customer first = Fixtures.customer("Eerste", BillingType.HOURLY, "AA-11-AA");
        Customer second = Fixtures.customer("Tweede", BillingType.HOURLY, "AA-11-AA");
        when(repository.findByAssignedLicensePlate("AA-11-AA")).thenReturn(List.of(first, second));

        assertThat(resolver.resolve(Fixtures.weeklyLog("d1", workedDay(MONDAY, "AA-11-AA")))).containsSame(first);
    }

    @Test
    void noPlateOnWorkedDaysMeansNoLookup() {
        WeeklyLog log = Fixtures.weeklyLog("d1",
                workedDay(MONDAY, " "),
                dayWithStatus(MONDAY.plusDays(1), DayStatus.VACATION, "AA-11-AA"));

        assertThat(resolver.resolve(log)).isEmpty();
        verify(repository, never()).findByAssignedLicensePlate(anyString());
    }

    @Test
    void unknownPlateThrowsWithWorkedPlates() {
        WeeklyLog log = Fixtures.weeklyLog("d1",
                workedDay(MONDAY, "ZZ-99-ZZ"),
                workedDay(MONDAY.plusDays(1), "YY-88-YY"));
        when(repository.findByAssignedLicensePlate(anyString())).thenReturn(List.of());

        assertThatThrownBy(() -> resolver.resolveOrThrow(log))
                .isInstanceOf(NoCustomerFoundException.class)
                .hasMessage("Geen klant gevonden voor kenteken in weekstaat.")
                .satisfies(e -> assertThat(((NoCustomerFoundException) e).getLicensePlates())
                        .containsExactly("ZZ-99-ZZ", "YY-88-YY"));
    }
}
