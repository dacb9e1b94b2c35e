package com.goerdes.textguard.index;

import com.goerdes.textguard.components.MinHashProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the single in-memory {@link BandedIndex}, restored from its snapshot.
 * <p>
 * Band parameters for 128 permutations, with the approximate similarity at which the
 * collision probability reaches one half, (1/b)^(1/r):
 * <ul>
 *   <li>b=64, r=2: 0.13</li>
 *   <li>b=32, r=4: 0.42 (default)</li>
 *   <li>b=20, r=6: 0.61</li>
 *   <li>b=16, r=8: 0.71</li>
 * </ul>
 */
@Configuration
public class IndexConfig {

    @Bean
    public BandedIndex bandedIndex(MinHashProvider minHashProvider,
                                   IndexSnapshotStore snapshotStore,
                                   @Value("${textguard.index.bands:32}") int bands,
                                   @Value("${textguard.index.rows:4}") int rows) {
        return snapshotStore.load(minHashProvider.seedTable(), bands, rows);
    }

}
