package org.dbtable.samples;

import org.dbtable.table.TableGateway;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A row of {@link EmployeeTable}.
 */
public class EmployeeRow extends SampleRow {

    public EmployeeRow(TableGateway<?> table, Map<String, ?> values) {
        super(table, values);
    }

    public String getEmpno() {
        return getString(EmployeeTable.EMPNO);
    }

    public void setEmpno(String empno) {
        setColumn(EmployeeTable.EMPNO, empno);
    }

    public String getFirstName() {
        return getString(EmployeeTable.FIRSTNAME);
    }

    public void setFirstName(String firstName) {
        setColumn(EmployeeTable.FIRSTNAME, firstName);
    }

    public String getMiddleInitial() {
        return getString(EmployeeTable.MIDINIT);
    }

    public void setMiddleInitial(String middleInitial) {
        setColumn(EmployeeTable.MIDINIT, middleInitial);
    }

    public String getLastName() {
        return getString(EmployeeTable.LASTNAME);
    }

    public void setLastName(String lastName) {
        setColumn(EmployeeTable.LASTNAME, lastName);
    }

    public BigDecimal getSalary() {
        return getDecimal(EmployeeTable.SALARY);
    }

    public void setSalary(BigDecimal salary) {
        setColumn(EmployeeTable.SALARY, salary);
    }
}
