package it.insurapro.crm.query;

import it.insurapro.crm.model.Customer;
import lombok.Value;

@Value
public class CustomerMatch {
    int position;
    Customer customer;
}
