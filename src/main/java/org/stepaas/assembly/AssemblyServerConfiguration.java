package org.stepaas.assembly;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.stepaas.assembly.step.ComponentClassifier;
import org.stepaas.assembly.step.StepRecordExtractor;
import org.stepaas.assembly.step.StepReferenceResolver;

/**
 * 装配构建服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>解析相关组件都是无状态的，可以在多次运行间共享。</li>
 *   <li>标识符分配器、组件登记表、装配树属于单次运行，由 {@link AssemblyBatchBuilder} 每次新建，不在这里声明。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class AssemblyServerConfiguration {

    static final String TAXONOMY_DICTIONARY = "taxonomy/classes.csv";

    @Bean
    public SecurePathResolver securePathResolver(AssemblyServerProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public StepDocumentReader stepDocumentReader(AssemblyServerProperties properties) {
        return new StepDocumentReader(properties.getMaxDocumentBytes().toBytes());
    }

    @Bean
    public StepRecordExtractor stepRecordExtractor() {
        return new StepRecordExtractor();
    }

    @Bean
    public StepReferenceResolver stepReferenceResolver() {
        return new StepReferenceResolver();
    }

    @Bean
    public ComponentClassifier componentClassifier() {
        return new ComponentClassifier();
    }

    @Bean
    public GeometryService geometryService(StepDocumentReader reader) {
        return new PointCloudGeometryService(reader);
    }

    @Bean
    public TaxonomyService taxonomyService() {
        return new DictionaryTaxonomyService(new ClassPathResource(TAXONOMY_DICTIONARY));
    }

    @Bean
    public AssemblyStructureMapper assemblyStructureMapper(TaxonomyService taxonomy, ComponentClassifier classifier) {
        return new AssemblyStructureMapper(taxonomy, classifier);
    }

    @Bean
    public AssemblyBatchBuilder assemblyBatchBuilder(AssemblyServerProperties properties,
                                                     StepDocumentReader reader,
                                                     StepRecordExtractor extractor,
                                                     StepReferenceResolver resolver,
                                                     ComponentClassifier classifier,
                                                     GeometryService geometryService,
                                                     AssemblyStructureMapper mapper) {
        return new AssemblyBatchBuilder(properties, reader, extractor, resolver, classifier, geometryService, mapper);
    }
}
