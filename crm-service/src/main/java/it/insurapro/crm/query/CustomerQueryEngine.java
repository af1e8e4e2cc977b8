package it.insurapro.crm.query;

import it.insurapro.crm.model.Customer;
import it.insurapro.crm.repository.CustomerStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Read-only substring search over the store.
 *
 * Each call works on a fresh snapshot of the store and returns a lazy stream;
 * nothing is cached between calls. No index: every search is a full scan.
 */
@Component
@RequiredArgsConstructor
public class CustomerQueryEngine {

    private final CustomerStore customerStore;

    public Stream<CustomerMatch> searchCustomers(String term) {
        List<Customer> customers = customerStore.snapshot();

        return IntStream.range(0, customers.size())
                .filter(i -> customers.get(i).matches(term))
                .mapToObj(i -> new CustomerMatch(i, customers.get(i)));
    }

    /**
     * Customers in store order, then each customer's interactions in list order.
     */
    public Stream<InteractionMatch> searchInteractions(String term) {
        List<Customer> customers = customerStore.snapshot();

        return IntStream.range(0, customers.size())
                .boxed()
                .flatMap(c -> {
                    Customer customer = customers.get(c);
                    return IntStream.range(0, customer.getInteractionCount())
                            .filter(i -> customer.getInteractions().get(i).matches(term))
                            .mapToObj(i -> new InteractionMatch(c, customer, i, customer.getInteractions().get(i)));
                });
    }
}
